package com.qrl.review.embed;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class EmbeddingConfigTest {

    @Test
    void clientIdentifiesItselfToProvider() {
        EmbeddingProperties properties = new EmbeddingProperties();
        properties.setBaseUrl("https://embeddings.test");
        RestTemplate restTemplate = new EmbeddingConfig().embeddingRestTemplate(new RestTemplateBuilder(), properties);
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        server.expect(requestTo("https://embeddings.test/v1/embeddings"))
            .andExpect(header("User-Agent", EmbeddingConfig.USER_AGENT))
            .andRespond(withSuccess("{\"data\":[{\"index\":0,\"embedding\":[0.5,0.5]}]}", MediaType.APPLICATION_JSON));

        assertThat(new EmbeddingGateway(restTemplate, properties).embed("refund never arrived")).containsExactly(0.5, 0.5);
        server.verify();
    }

    @Test
    void connectTimeoutNeverExceedsRequestTimeout() {
        EmbeddingProperties properties = new EmbeddingProperties();
        assertThat(EmbeddingConfig.connectTimeout(properties)).isEqualTo(Duration.ofMillis(2000));

        properties.setTimeoutMs(500);
        assertThat(EmbeddingConfig.connectTimeout(properties)).isEqualTo(Duration.ofMillis(500));
    }
}
