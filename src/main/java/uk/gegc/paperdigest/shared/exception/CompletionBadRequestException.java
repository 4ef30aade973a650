package uk.gegc.paperdigest.shared.exception;

import lombok.Getter;

/**
 * The completion service rejected the request itself (HTTP 400). Never retried.
 */
@Getter
public class CompletionBadRequestException extends AiServiceException {

    private final String responseBody;

    public CompletionBadRequestException(String message, String responseBody) {
        super(message);
        this.responseBody = responseBody;
    }
}
