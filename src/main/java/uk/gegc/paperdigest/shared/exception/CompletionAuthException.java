package uk.gegc.paperdigest.shared.exception;

/**
 * The completion service rejected the credential (HTTP 401). Never retried.
 */
public class CompletionAuthException extends AiServiceException {

    public CompletionAuthException(String message) {
        super(message);
    }
}
