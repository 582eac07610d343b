package com.qrl.review.text;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

@Configuration
@EnableConfigurationProperties(TextProperties.class)
public class TextConfig {

    @Bean
    public StopWordList stopWordList(ResourceLoader resourceLoader, TextProperties properties) {
        return StopWordList.load(
            resourceLoader.getResource(properties.getStopWordsLocation()),
            properties.getExtraStopWords()
        );
    }

    @Bean
    public KeywordExtractor keywordExtractor(StopWordList stopWordList, TextProperties properties) {
        return new KeywordExtractor(stopWordList, properties.getMinTokenLength(), properties.getMaxTokens());
    }

    @Bean
    public ReviewTextExtractor reviewTextExtractor(TextProperties properties) {
        return new ReviewTextExtractor(properties.getMinEmbeddableLength());
    }
}
