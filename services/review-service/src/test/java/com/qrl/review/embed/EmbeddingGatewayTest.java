package com.qrl.review.embed;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class EmbeddingGatewayTest {
    private static final String URL = "https://embeddings.test/v1/embeddings";
    private static final String OK_BODY = "{\"model\":\"text-embedding-3-small\",\"data\":[{\"index\":0,\"embedding\":[0.25,-0.5,0.75]}]}";

    private MockRestServiceServer server;
    private EmbeddingProperties properties;
    private EmbeddingGateway gateway;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        properties = new EmbeddingProperties();
        properties.setBaseUrl("https://embeddings.test/");
        properties.setApiKey("sk-test");
        properties.setRetryCount(1);
        gateway = new EmbeddingGateway(restTemplate, properties);
    }

    @Test
    void postsModelAndInputWithBearerKey() {
        server.expect(requestTo(URL))
            .andExpect(method(HttpMethod.POST))
            .andExpect(header("Authorization", "Bearer sk-test"))
            .andExpect(jsonPath("$.model").value("text-embedding-3-small"))
            .andExpect(jsonPath("$.input[0]").value("agent skipped identity check"))
            .andRespond(withSuccess(OK_BODY, MediaType.APPLICATION_JSON));

        List<Double> vector = gateway.embed("agent skipped identity check");

        assertThat(vector).containsExactly(0.25, -0.5, 0.75);
        server.verify();
    }

    @Test
    void retriesServerErrorOnce() {
        server.expect(requestTo(URL)).andRespond(withServerError());
        server.expect(requestTo(URL)).andRespond(withSuccess(OK_BODY, MediaType.APPLICATION_JSON));

        assertThat(gateway.embed("agent skipped identity check")).hasSize(3);
        server.verify();
    }

    @Test
    void clientErrorIsNotRetried() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        assertThatThrownBy(() -> gateway.embed("agent skipped identity check"))
            .isInstanceOf(EmbeddingUnavailableException.class)
            .hasMessage("embed_http_401");
        server.verify();
    }

    @Test
    void emptyDataIsReported() {
        server.expect(requestTo(URL))
            .andRespond(withSuccess("{\"data\":[]}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> gateway.embed("agent skipped identity check"))
            .hasMessage("embed_empty_response");
    }
}
