package com.qrl.review.retrieval;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(SimilarityProperties.class)
public class SimilarityConfig {
}
