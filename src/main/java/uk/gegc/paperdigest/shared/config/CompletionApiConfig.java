package uk.gegc.paperdigest.shared.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import uk.gegc.paperdigest.features.ai.domain.model.TaskType;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Connection and sampling settings for the remote text-completion service.
 */
@Component
@ConfigurationProperties(prefix = "completion.api")
@Data
public class CompletionApiConfig {

    private String provider = "Together.AI";

    private String baseUrl = "https://api.together.xyz/v1";

    /**
     * Bearer credential; bound from TOGETHER_API_KEY in application.yml
     */
    private String apiKey;

    private int maxTokens = 2048;

    private List<String> stopSequences = new ArrayList<>(List.of("</s>", "Human:", "Assistant:"));

    private Duration connectTimeout = Duration.ofSeconds(10);

    private Duration readTimeout = Duration.ofSeconds(180);

    private Tasks tasks = new Tasks();

    public TaskSettings settingsFor(TaskType taskType) {
        return switch (taskType) {
            case SUMMARIZER -> tasks.getSummarizer();
            case LEVEL_ADAPTER -> tasks.getLevelAdapter();
            case FLASHCARD_GEN -> tasks.getFlashcardGen();
        };
    }

    @Data
    public static class Tasks {
        private TaskSettings summarizer = new TaskSettings();
        private TaskSettings levelAdapter = new TaskSettings();
        private TaskSettings flashcardGen = new TaskSettings();
    }

    @Data
    public static class TaskSettings {
        private String model = "meta-llama/Llama-3.3-70B-Instruct-Turbo";
        private double temperature = 0.7;
        private double topP = 0.9;
        private double repetitionPenalty = 1.1;

        /**
         * Maximum characters per chunk sent to this task
         */
        private int maxLength = 2048;
    }
}
