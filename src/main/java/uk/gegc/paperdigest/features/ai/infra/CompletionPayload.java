package uk.gegc.paperdigest.features.ai.infra;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Request body of the OpenAI-style {@code /completions} endpoint.
 */
record CompletionPayload(
        String model,
        String prompt,
        @JsonProperty("max_tokens") int maxTokens,
        double temperature,
        @JsonProperty("top_p") double topP,
        @JsonProperty("repetition_penalty") double repetitionPenalty,
        List<String> stop
) {
}
