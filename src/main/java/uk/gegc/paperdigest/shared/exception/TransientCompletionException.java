package uk.gegc.paperdigest.shared.exception;

/**
 * Network failure or unexpected HTTP status from the completion service. Retried with backoff.
 */
public class TransientCompletionException extends AiServiceException {

    /**
     * HTTP status, or -1 when the call never produced a response
     */
    private final int statusCode;

    public TransientCompletionException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public TransientCompletionException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
