package uk.gegc.paperdigest.shared.exception;

public class MissingCredentialException extends IllegalStateException {

    public MissingCredentialException(String message) {
        super(message);
    }
}
