package uk.gegc.paperdigest.features.ai.domain.model;

import java.util.Objects;

/**
 * One prompt bound for the completion service. Built by a task for a single chunk and consumed once by the
 * dispatcher; retries happen inside that one dispatch.
 *
 * @param taskType    task whose model and sampling settings apply
 * @param prompt      full prompt text
 * @param chunkIndex  zero-based position of the chunk the prompt was built from
 * @param totalChunks number of chunks in the task
 */
public record CompletionRequest(TaskType taskType, String prompt, int chunkIndex, int totalChunks) {

    public CompletionRequest {
        Objects.requireNonNull(taskType, "taskType");
        Objects.requireNonNull(prompt, "prompt");
        if (chunkIndex < 0 || totalChunks < 1 || chunkIndex >= totalChunks) {
            throw new IllegalArgumentException(
                    "Chunk index " + chunkIndex + " is outside 0.." + (totalChunks - 1));
        }
    }

    /**
     * Request that is not tied to a chunk sequence (combining passes, fallbacks, single-shot prompts).
     */
    public static CompletionRequest single(TaskType taskType, String prompt) {
        return new CompletionRequest(taskType, prompt, 0, 1);
    }

    public String describe() {
        return taskType.getKey() + " chunk " + (chunkIndex + 1) + "/" + totalChunks;
    }
}
