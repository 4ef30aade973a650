package uk.gegc.paperdigest.features.ai.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import uk.gegc.paperdigest.features.ai.application.CompletionModel;
import uk.gegc.paperdigest.features.ai.domain.model.TaskType;
import uk.gegc.paperdigest.shared.config.CompletionApiConfig;
import uk.gegc.paperdigest.shared.exception.CompletionAuthException;
import uk.gegc.paperdigest.shared.exception.CompletionBadRequestException;
import uk.gegc.paperdigest.shared.exception.RateLimitExceededException;
import uk.gegc.paperdigest.shared.exception.TransientCompletionException;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * {@link CompletionModel} backed by an OpenAI-compatible HTTP completions endpoint.
 * Maps response statuses onto the completion error taxonomy; never retries.
 */
@Slf4j
public class RestCompletionModel implements CompletionModel {

    static final String COMPLETIONS_PATH = "/completions";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final CompletionApiConfig apiConfig;
    private final TaskType taskType;
    private final long defaultRetryAfterSeconds;

    public RestCompletionModel(RestClient restClient,
                               ObjectMapper objectMapper,
                               CompletionApiConfig apiConfig,
                               TaskType taskType,
                               long defaultRetryAfterSeconds) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.apiConfig = apiConfig;
        this.taskType = taskType;
        this.defaultRetryAfterSeconds = defaultRetryAfterSeconds;
    }

    @Override
    public String complete(String prompt) {
        CompletionApiConfig.TaskSettings settings = apiConfig.settingsFor(taskType);
        CompletionPayload payload = new CompletionPayload(
                settings.getModel(),
                prompt,
                apiConfig.getMaxTokens(),
                settings.getTemperature(),
                settings.getTopP(),
                settings.getRepetitionPenalty(),
                List.copyOf(apiConfig.getStopSequences())
        );

        try {
            return restClient.post()
                    .uri(COMPLETIONS_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .exchange((request, response) -> {
                        int status = response.getStatusCode().value();
                        String body = StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
                        return handleResponse(status, response.getHeaders(), body);
                    });
        } catch (RestClientException e) {
            throw new TransientCompletionException("Completion request failed: " + e.getMessage(), e);
        }
    }

    private String handleResponse(int status, HttpHeaders headers, String body) {
        if (status >= 200 && status < 300) {
            return extractText(body);
        }
        if (status == 429) {
            long retryAfter = parseRetryAfter(headers.getFirst(HttpHeaders.RETRY_AFTER));
            throw new RateLimitExceededException("Completion service rate limit exceeded", retryAfter);
        }
        if (status == 401) {
            throw new CompletionAuthException("Invalid API key. Please check your " + apiConfig.getProvider() + " API key.");
        }
        if (status == 400) {
            throw new CompletionBadRequestException("Completion service rejected the request", body);
        }
        log.warn("Completion service for {} answered {}: {}", taskType.getKey(), status, abbreviate(body));
        throw new TransientCompletionException("Completion service answered HTTP " + status, status);
    }

    private String extractText(String body) {
        try {
            JsonNode text = objectMapper.readTree(body).path("choices").path(0).path("text");
            if (!text.isTextual()) {
                throw new TransientCompletionException("Completion response has no choices[0].text", 200);
            }
            return text.asText().strip();
        } catch (JsonProcessingException e) {
            throw new TransientCompletionException("Completion response is not valid JSON", e);
        }
    }

    private long parseRetryAfter(String header) {
        if (header == null || header.isBlank()) {
            return defaultRetryAfterSeconds;
        }
        try {
            return Math.max(1, Long.parseLong(header.trim()));
        } catch (NumberFormatException e) {
            log.debug("Unparseable Retry-After header '{}', using {} s", header, defaultRetryAfterSeconds);
            return defaultRetryAfterSeconds;
        }
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }
}
