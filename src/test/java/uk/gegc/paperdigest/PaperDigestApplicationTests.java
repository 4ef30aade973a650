package uk.gegc.paperdigest;

import com.github.tomakehurst.wiremock.WireMockServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockMvcRequestBuilders;
import uk.gegc.paperdigest.features.ai.application.CompletionDispatcher;
import uk.gegc.paperdigest.features.ai.application.impl.RateLimitedCompletionDispatcher;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.containing;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("PaperDigest application")
class PaperDigestApplicationTests {

    private static final WireMockServer COMPLETION_API = new WireMockServer(wireMockConfig().dynamicPort());

    static {
        COMPLETION_API.start();
    }

    @DynamicPropertySource
    static void completionApi(DynamicPropertyRegistry registry) {
        registry.add("completion.api.base-url", () -> COMPLETION_API.baseUrl() + "/v1");
    }

    @AfterAll
    static void stopCompletionApi() {
        COMPLETION_API.stop();
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private CompletionDispatcher completionDispatcher;

    @BeforeEach
    void resetStubs() {
        COMPLETION_API.resetAll();
    }

    @Test
    @DisplayName("context wires the rate-limited dispatcher")
    void contextLoads() {
        assertThat(completionDispatcher).isInstanceOf(RateLimitedCompletionDispatcher.class);
    }

    @Test
    @DisplayName("POST /api/v1/text/summary goes through the completion API with the bearer key")
    void summary_endToEnd() throws Exception {
        COMPLETION_API.stubFor(post(urlEqualTo("/v1/completions"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody("{\"choices\":[{\"text\":\"Summary: It works.\\nKey Highlights:\\n* **Findings:** yes\"}]}")));

        mockMvc.perform(MockMvcRequestBuilders.post("/api/v1/text/summary")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"A short paper.\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.summary").value("It works."))
                .andExpect(jsonPath("$.highlights[0]").value("* **Findings:** yes"));

        COMPLETION_API.verify(postRequestedFor(urlEqualTo("/v1/completions"))
                .withHeader("Authorization", equalTo("Bearer test-key"))
                .withRequestBody(containing("A short paper.")));
    }

    @Test
    @DisplayName("a 429 from the completion API surfaces as 429 with Retry-After")
    void rateLimited_endToEnd() throws Exception {
        COMPLETION_API.stubFor(post(urlEqualTo("/v1/completions"))
                .willReturn(aResponse().withStatus(429).withHeader("Retry-After", "1")));

        mockMvc.perform(MockMvcRequestBuilders.post("/api/v1/text/key-concepts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"A short paper.\"}"))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "1"));

        COMPLETION_API.verify(1, postRequestedFor(urlEqualTo("/v1/completions")));
    }

    @Test
    @DisplayName("GET /v3/api-docs publishes the text endpoints")
    void apiDocs_available() throws Exception {
        mockMvc.perform(get("/v3/api-docs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.paths['/api/v1/text/summary']").exists());
    }
}
