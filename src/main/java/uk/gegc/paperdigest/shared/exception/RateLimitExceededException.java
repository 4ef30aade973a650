package uk.gegc.paperdigest.shared.exception;

/**
 * Raised after the dispatcher has already waited out a server-side 429 cooldown.
 */
public class RateLimitExceededException extends AiServiceException {
    private final long retryAfterSeconds;

    public RateLimitExceededException(String message, long retryAfterSeconds) {
        super(message);
        this.retryAfterSeconds = Math.max(1, retryAfterSeconds);
    }

    public RateLimitExceededException(String message) {
        this(message, 60); // Default 1 minute
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
