package jellyvr.core.model.session;

/**
 * Lifecycle of a QuickConnect request. Transitions only go from
 * {@link #PENDING} to one of the terminal states.
 */
public enum QuickConnectRequestStatus {
    PENDING,
    AUTHORIZED,
    EXPIRED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
