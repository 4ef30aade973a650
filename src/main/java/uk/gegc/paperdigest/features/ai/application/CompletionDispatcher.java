package uk.gegc.paperdigest.features.ai.application;

import uk.gegc.paperdigest.features.ai.domain.model.CompletionRequest;
import uk.gegc.paperdigest.features.ai.domain.model.TaskType;

/**
 * Rate-gated entry point for every outbound completion call.
 * All tasks share one dispatcher so they draw from a single requests-per-minute quota.
 */
public interface CompletionDispatcher {

    /**
     * Waits for admission, issues the request and retries transient failures with exponential backoff.
     *
     * @return raw completion text
     * @throws uk.gegc.paperdigest.shared.exception.RateLimitExceededException after the server cooldown was waited out
     * @throws uk.gegc.paperdigest.shared.exception.CompletionAuthException    credential rejected, not retried
     * @throws uk.gegc.paperdigest.shared.exception.CompletionBadRequestException request rejected, not retried
     * @throws uk.gegc.paperdigest.shared.exception.TransientCompletionException  retries exhausted
     */
    String dispatch(CompletionRequest request);

    default String dispatch(TaskType taskType, String prompt) {
        return dispatch(CompletionRequest.single(taskType, prompt));
    }
}
