package jellyvr.spi;

/**
 * Thrown when a store provider cannot be selected or initialized.
 */
public class StorageProviderException extends RuntimeException {

    private final String providerName;

    public StorageProviderException(String providerName, String message) {
        super(message);
        this.providerName = providerName;
    }

    public StorageProviderException(String providerName, String message, Throwable cause) {
        super(message, cause);
        this.providerName = providerName;
    }

    public String getProviderName() {
        return providerName;
    }
}
