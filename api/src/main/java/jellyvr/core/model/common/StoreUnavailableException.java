package jellyvr.core.model.common;

/**
 * The durability layer could not complete an operation.
 *
 * <p>Covers I/O errors, timeouts and records that can no longer be decoded.
 * Callers treat it as fatal for the in-flight request; the operation may be
 * retried later.
 */
public class StoreUnavailableException extends RuntimeException {

    private final String operation;

    public StoreUnavailableException(String operation, String message) {
        super(message);
        this.operation = operation;
    }

    public StoreUnavailableException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    /** Returns the store operation that failed. */
    public String getOperation() {
        return operation;
    }
}
