package uk.gegc.paperdigest.shared.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestClient;
import uk.gegc.paperdigest.shared.exception.MissingCredentialException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RestClientConfig Tests")
class RestClientConfigTest {

    private final RestClientConfig restClientConfig = new RestClientConfig();

    @Test
    @DisplayName("completionRestClient: a blank API key fails fast")
    void completionRestClient_blankKey_throws() {
        CompletionApiConfig apiConfig = new CompletionApiConfig();
        apiConfig.setApiKey("  ");

        assertThatThrownBy(() -> restClientConfig.completionRestClient(RestClient.builder(), apiConfig))
                .isInstanceOf(MissingCredentialException.class)
                .hasMessageContaining("TOGETHER_API_KEY");
    }

    @Test
    @DisplayName("completionRestClient: a missing API key fails fast")
    void completionRestClient_nullKey_throws() {
        assertThatThrownBy(() -> restClientConfig.completionRestClient(RestClient.builder(), new CompletionApiConfig()))
                .isInstanceOf(MissingCredentialException.class);
    }

    @Test
    @DisplayName("completionRestClient: builds a client when a key is configured")
    void completionRestClient_withKey_builds() {
        CompletionApiConfig apiConfig = new CompletionApiConfig();
        apiConfig.setApiKey("secret");

        assertThat(restClientConfig.completionRestClient(RestClient.builder(), apiConfig)).isNotNull();
    }
}
