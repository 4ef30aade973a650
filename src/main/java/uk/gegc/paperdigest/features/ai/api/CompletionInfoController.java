package uk.gegc.paperdigest.features.ai.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.paperdigest.features.ai.api.dto.CompletionInfoResponse;
import uk.gegc.paperdigest.features.ai.domain.model.TaskType;
import uk.gegc.paperdigest.shared.config.AiRateLimitConfig;
import uk.gegc.paperdigest.shared.config.CompletionApiConfig;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/completion")
@RequiredArgsConstructor
@Tag(name = "Completion", description = "Completion provider information")
public class CompletionInfoController {

    private final CompletionApiConfig completionApiConfig;
    private final AiRateLimitConfig rateLimitConfig;

    @Operation(summary = "Describe the completion provider", description = "Provider, base URL, per-task models and the client-side rate limit")
    @GetMapping("/info")
    public ResponseEntity<CompletionInfoResponse> info() {
        Map<String, String> models = new LinkedHashMap<>();
        for (TaskType taskType : TaskType.values()) {
            models.put(taskType.getKey(), completionApiConfig.settingsFor(taskType).getModel());
        }
        return ResponseEntity.ok(new CompletionInfoResponse(
                completionApiConfig.getProvider(),
                completionApiConfig.getBaseUrl(),
                models,
                rateLimitConfig.getRequestsPerMinute() + " requests per minute",
                rateLimitConfig.getMinIntervalMs()
        ));
    }
}
