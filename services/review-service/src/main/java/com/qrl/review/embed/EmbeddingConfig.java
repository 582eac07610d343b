package com.qrl.review.embed;

import java.time.Duration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestTemplate;

@Configuration
@EnableConfigurationProperties(EmbeddingProperties.class)
public class EmbeddingConfig {
    static final String USER_AGENT = "review-service/embeddings";

    /** Client for the embeddings endpoint. The connect timeout is capped at the request timeout. */
    @Bean
    public RestTemplate embeddingRestTemplate(RestTemplateBuilder builder, EmbeddingProperties properties) {
        return builder
            .setConnectTimeout(connectTimeout(properties))
            .setReadTimeout(Duration.ofMillis(Math.max(1, properties.getTimeoutMs())))
            .defaultHeader(HttpHeaders.USER_AGENT, USER_AGENT)
            .build();
    }

    static Duration connectTimeout(EmbeddingProperties properties) {
        int readTimeoutMs = Math.max(1, properties.getTimeoutMs());
        return Duration.ofMillis(Math.min(Math.max(1, properties.getConnectTimeoutMs()), readTimeoutMs));
    }
}
