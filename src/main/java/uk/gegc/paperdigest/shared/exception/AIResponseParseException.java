package uk.gegc.paperdigest.shared.exception;

/**
 * Exception thrown when a raw completion cannot be turned into a structured result
 */
public class AIResponseParseException extends RuntimeException {

    public AIResponseParseException(String message) {
        super(message);
    }

    public AIResponseParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
