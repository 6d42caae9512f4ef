package uk.gegc.covenhub.features.asset.domain.exception;

/**
 * Failure reported by the object-storage collaborator. Retryable failures are safe
 * to repeat at single-chunk granularity; the rest are surfaced and may fail the session.
 */
public class StorageException extends RuntimeException {

    private final boolean retryable;

    public StorageException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public StorageException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
