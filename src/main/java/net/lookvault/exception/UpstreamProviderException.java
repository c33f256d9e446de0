package net.lookvault.exception;

/**
 * A paid upstream (product search, marketplace browse) failed to answer usefully:
 * network error, non-success status or a malformed payload.
 * RETRYABLE: depends on the cause, see {@link #isRetryable()}
 */
public class UpstreamProviderException extends RuntimeException {

    private final String providerName;
    private final boolean retryable;

    public UpstreamProviderException(String providerName, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.providerName = providerName;
        this.retryable = retryable;
    }

    public UpstreamProviderException(String providerName, String message, boolean retryable) {
        this(providerName, message, retryable, null);
    }

    public String getProviderName() {
        return providerName;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
