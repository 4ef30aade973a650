package uk.gegc.paperdigest.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import uk.gegc.paperdigest.shared.exception.MissingCredentialException;

@Configuration
@Slf4j
public class RestClientConfig {

    /**
     * Builds the client used for every completion call. A missing credential stops the context from starting,
     * so no dispatch can ever run without one.
     */
    @Bean
    public RestClient completionRestClient(RestClient.Builder builder, CompletionApiConfig apiConfig) {
        String apiKey = apiConfig.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            throw new MissingCredentialException(
                    "Completion API key is not set. Export TOGETHER_API_KEY or set completion.api.api-key");
        }

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(apiConfig.getConnectTimeout());
        requestFactory.setReadTimeout(apiConfig.getReadTimeout());

        log.info("Configuring completion client for {} at {}", apiConfig.getProvider(), apiConfig.getBaseUrl());
        return builder
                .baseUrl(apiConfig.getBaseUrl())
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey.trim())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
