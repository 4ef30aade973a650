package uk.gegc.paperdigest.features.ai.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Map;

@Schema(name = "CompletionInfoResponse", description = "Completion provider and the models used per task")
public record CompletionInfoResponse(
        @Schema(description = "Provider name", example = "Together.AI")
        String provider,

        @Schema(description = "Base URL of the completions API", example = "https://api.together.xyz/v1")
        String baseUrl,

        @Schema(description = "Model identifier per task")
        Map<String, String> models,

        @Schema(description = "Client-side rate limit", example = "60 requests per minute")
        String rateLimit,

        @Schema(description = "Minimum spacing between requests in milliseconds", example = "1000")
        long minIntervalMs
) {
}
