package com.qrl.review.embed;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.net.SocketTimeoutException;
import java.util.List;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

/** Client for an OpenAI-compatible {@code POST /v1/embeddings} endpoint. */
@Component
public class EmbeddingGateway {
    private final RestTemplate restTemplate;
    private final EmbeddingProperties properties;

    public EmbeddingGateway(
        @Qualifier("embeddingRestTemplate") RestTemplate restTemplate,
        EmbeddingProperties properties
    ) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    public List<Double> embed(String text) {
        if (text == null || text.isBlank()) {
            throw new EmbeddingUnavailableException("embed_empty_text");
        }
        if (properties.getBaseUrl() == null || properties.getBaseUrl().isBlank()) {
            throw new EmbeddingUnavailableException("embed_base_url_missing");
        }
        EmbeddingRequest request = new EmbeddingRequest(properties.getModel(), List.of(text));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (properties.getApiKey() != null && !properties.getApiKey().isBlank()) {
            headers.setBearerAuth(properties.getApiKey());
        }
        HttpEntity<EmbeddingRequest> entity = new HttpEntity<>(request, headers);

        int retries = Math.max(0, properties.getRetryCount());
        for (int attempt = 0; attempt <= retries; attempt++) {
            try {
                ResponseEntity<EmbeddingResponse> response = restTemplate.exchange(
                    buildUrl("/v1/embeddings"),
                    HttpMethod.POST,
                    entity,
                    EmbeddingResponse.class
                );
                return extractVector(response.getBody());
            } catch (ResourceAccessException e) {
                if (attempt >= retries) {
                    String reason = e.getCause() instanceof SocketTimeoutException ? "embed_timeout" : "embed_unavailable";
                    throw new EmbeddingUnavailableException(reason, e);
                }
            } catch (HttpStatusCodeException e) {
                // 4xx other than throttling will not succeed on retry
                boolean retryable = e.getStatusCode().is5xxServerError() || e.getStatusCode().value() == 429;
                if (!retryable || attempt >= retries) {
                    throw new EmbeddingUnavailableException("embed_http_" + e.getStatusCode().value(), e);
                }
            }
        }
        throw new EmbeddingUnavailableException("embed_unavailable");
    }

    private List<Double> extractVector(EmbeddingResponse body) {
        if (body == null || body.data() == null || body.data().isEmpty()) {
            throw new EmbeddingUnavailableException("embed_empty_response");
        }
        List<Double> vector = body.data().get(0).embedding();
        if (vector == null || vector.isEmpty()) {
            throw new EmbeddingUnavailableException("embed_empty_vector");
        }
        return vector;
    }

    private String buildUrl(String path) {
        String base = properties.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }

    record EmbeddingRequest(String model, List<String> input) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EmbeddingResponse(List<EmbeddingData> data) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record EmbeddingData(int index, List<Double> embedding) {
    }
}
