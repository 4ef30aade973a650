package uk.gegc.paperdigest.shared.exception;

/**
 * Exception thrown when the completion service or its client encounters an error
 */
public class AiServiceException extends RuntimeException {

    public AiServiceException(String message) {
        super(message);
    }

    public AiServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
