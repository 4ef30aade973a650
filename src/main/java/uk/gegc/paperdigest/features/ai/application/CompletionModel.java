package uk.gegc.paperdigest.features.ai.application;

import uk.gegc.paperdigest.shared.exception.CompletionAuthException;
import uk.gegc.paperdigest.shared.exception.CompletionBadRequestException;
import uk.gegc.paperdigest.shared.exception.RateLimitExceededException;
import uk.gegc.paperdigest.shared.exception.TransientCompletionException;

/**
 * A text-completion backend bound to one task's model and sampling settings.
 * Abstracts away the HTTP provider so the dispatcher and the tasks can run against a deterministic fake.
 * <p>
 * One call is one attempt: implementations never retry and never wait.
 */
@FunctionalInterface
public interface CompletionModel {

    /**
     * @param prompt full prompt text
     * @return the trimmed completion text
     * @throws RateLimitExceededException    when the service answers 429 (carries the requested cooldown)
     * @throws CompletionAuthException       when the credential is rejected
     * @throws CompletionBadRequestException when the service rejects the request as malformed
     * @throws TransientCompletionException  for network failures and any other non-2xx status
     */
    String complete(String prompt);
}
