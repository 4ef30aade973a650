package uk.gegc.paperdigest.shared.exception;

/**
 * Thrown by paper sources that exist only as an integration point.
 */
public class PaperSourceUnavailableException extends RuntimeException {

    public PaperSourceUnavailableException(String message) {
        super(message);
    }
}
