package uk.gegc.paperdigest.features.ai.infra;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import uk.gegc.paperdigest.features.ai.application.CompletionModel;
import uk.gegc.paperdigest.features.ai.application.CompletionModelProvider;
import uk.gegc.paperdigest.features.ai.domain.model.TaskType;
import uk.gegc.paperdigest.shared.config.AiRateLimitConfig;
import uk.gegc.paperdigest.shared.config.CompletionApiConfig;

import java.util.EnumMap;
import java.util.Map;

@Component
public class RestCompletionModelProvider implements CompletionModelProvider {

    private final Map<TaskType, CompletionModel> models = new EnumMap<>(TaskType.class);

    public RestCompletionModelProvider(RestClient completionRestClient,
                                       ObjectMapper objectMapper,
                                       CompletionApiConfig apiConfig,
                                       AiRateLimitConfig rateLimitConfig) {
        for (TaskType taskType : TaskType.values()) {
            models.put(taskType, new RestCompletionModel(completionRestClient, objectMapper, apiConfig,
                    taskType, rateLimitConfig.getDefaultRetryAfterSeconds()));
        }
    }

    @Override
    public CompletionModel forTask(TaskType taskType) {
        return models.get(taskType);
    }
}
