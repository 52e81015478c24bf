package jellyvr.adapter.out.storage;

import java.time.Duration;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import jellyvr.core.model.common.StoreUnavailableException;

/**
 * Applies the store timeout and failure translation to backend operations.
 *
 * <p>Every failure is surfaced as {@link StoreUnavailableException}: a timeout,
 * an I/O error or a backend error. There is no degraded mode. Gateway state must
 * either be read and written durably or the request fails.
 */
public class StoreTimeoutHelper {

    private static final Logger LOG = Logger.getLogger(StoreTimeoutHelper.class);

    private final Duration timeout;
    private final String storeName;

    /**
     * Create a new timeout helper.
     *
     * @param timeout the timeout for a single store operation
     * @param storeName the backend name for logging
     */
    public StoreTimeoutHelper(Duration timeout, String storeName) {
        this.timeout = timeout;
        this.storeName = storeName;
    }

    /**
     * Apply the timeout to an operation and translate its failures.
     *
     * @param operation the backend operation
     * @param operationName name for logging and the resulting exception
     * @param <T> the result type
     * @return a Uni that fails with StoreUnavailableException on timeout or failure
     */
    public <T> Uni<T> withTimeout(Uni<T> operation, String operationName) {
        return operation
                .ifNoItem()
                .after(timeout)
                .failWith(() -> {
                    LOG.warnv("Store operation timeout: {0} in {1} after {2}", operationName, storeName, timeout);
                    return new StoreUnavailableException(
                            operationName, "Store operation " + operationName + " timed out in " + storeName);
                })
                .onFailure(error -> !(error instanceof StoreUnavailableException))
                .transform(error -> {
                    LOG.warnv("Store operation failure: {0} in {1}: {2}", operationName, storeName, error.getMessage());
                    return new StoreUnavailableException(
                            operationName, "Store operation " + operationName + " failed in " + storeName, error);
                });
    }

    public Duration getTimeout() {
        return timeout;
    }
}
