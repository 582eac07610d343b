package com.qrl.review.text;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "review.text")
public class TextProperties {
    private String stopWordsLocation = "classpath:text/stopwords.txt";
    private List<String> extraStopWords = new ArrayList<>();
    private int minTokenLength = 3;
    private int maxTokens = 15;
    private int minEmbeddableLength = 10;

    public String getStopWordsLocation() {
        return stopWordsLocation;
    }

    public void setStopWordsLocation(String stopWordsLocation) {
        this.stopWordsLocation = stopWordsLocation;
    }

    public List<String> getExtraStopWords() {
        return extraStopWords;
    }

    public void setExtraStopWords(List<String> extraStopWords) {
        this.extraStopWords = extraStopWords;
    }

    public int getMinTokenLength() {
        return minTokenLength;
    }

    public void setMinTokenLength(int minTokenLength) {
        this.minTokenLength = minTokenLength;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public void setMaxTokens(int maxTokens) {
        this.maxTokens = maxTokens;
    }

    public int getMinEmbeddableLength() {
        return minEmbeddableLength;
    }

    public void setMinEmbeddableLength(int minEmbeddableLength) {
        this.minEmbeddableLength = minEmbeddableLength;
    }
}
