package jellyvr.core.port.out;

/**
 * Port interface for recording gateway metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface GatewayMetrics {

    /**
     * Record the terminal outcome of a browser login.
     *
     * @param outcome approved, expired, rejected or superseded
     */
    void recordLogin(String outcome);

    /**
     * Record a session being issued.
     */
    void recordSessionCreated();

    /**
     * Record a local credential check.
     *
     * @param success whether the credentials were accepted
     */
    void recordLocalAuthentication(boolean success);

    /**
     * Record a playback report and what happened to it.
     *
     * @param disposition applied, duplicate or stale
     */
    void recordPlaybackReport(String disposition);

    /**
     * Record the outcome of relaying playback to Jellyfin.
     *
     * @param success whether Jellyfin accepted the report
     */
    void recordRelay(boolean success);

    /**
     * Record a store operation failure.
     *
     * @param operation get, put, delete or compareAndSwap
     */
    void recordStoreFailure(String operation);

    /**
     * Record a translated library being built.
     *
     * @param items number of items in the library
     * @param droppedItems items skipped because they could not be translated
     */
    void recordLibraryTranslated(int items, int droppedItems);
}
