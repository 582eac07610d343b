package com.qrl.review.resilience;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@EnableConfigurationProperties(ResilienceProperties.class)
public class ReviewResilienceRegistry {
    private final CircuitBreaker embedBreaker;
    private final CircuitBreaker summaryBreaker;
    private final CircuitBreaker vectorBreaker;

    public ReviewResilienceRegistry(ResilienceProperties properties) {
        this.embedBreaker = new CircuitBreaker(
            "embed", properties.getEmbedFailureThreshold(), properties.getEmbedOpenMs());
        this.summaryBreaker = new CircuitBreaker(
            "summary", properties.getSummaryFailureThreshold(), properties.getSummaryOpenMs());
        this.vectorBreaker = new CircuitBreaker(
            "vector", properties.getVectorFailureThreshold(), properties.getVectorOpenMs());
    }

    public CircuitBreaker getEmbedBreaker() {
        return embedBreaker;
    }

    public CircuitBreaker getSummaryBreaker() {
        return summaryBreaker;
    }

    /** Guards the interactive vector leg of similar-review search. */
    public CircuitBreaker getVectorBreaker() {
        return vectorBreaker;
    }
}
