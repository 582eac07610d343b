package com.qrl.review.retrieval;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "review.similar")
public class SimilarityProperties {
    private int keywordFloor = 20;
    private int keywordRawLimit = 100;
    private int keywordTopN = 5;
    private int vectorFloor = 25;
    private int vectorPoolLimit = 200;
    private int vectorTopN = 5;
    private int defaultLimit = 10;
    private int maxLimit = 50;
    private int minQueryLength = 10;
    private int vectorBudgetMs = 1500;

    public int getKeywordFloor() {
        return keywordFloor;
    }

    public void setKeywordFloor(int keywordFloor) {
        this.keywordFloor = keywordFloor;
    }

    public int getKeywordRawLimit() {
        return keywordRawLimit;
    }

    public void setKeywordRawLimit(int keywordRawLimit) {
        this.keywordRawLimit = keywordRawLimit;
    }

    public int getKeywordTopN() {
        return keywordTopN;
    }

    public void setKeywordTopN(int keywordTopN) {
        this.keywordTopN = keywordTopN;
    }

    public int getVectorFloor() {
        return vectorFloor;
    }

    public void setVectorFloor(int vectorFloor) {
        this.vectorFloor = vectorFloor;
    }

    public int getVectorPoolLimit() {
        return vectorPoolLimit;
    }

    public void setVectorPoolLimit(int vectorPoolLimit) {
        this.vectorPoolLimit = vectorPoolLimit;
    }

    public int getVectorTopN() {
        return vectorTopN;
    }

    public void setVectorTopN(int vectorTopN) {
        this.vectorTopN = vectorTopN;
    }

    public int getDefaultLimit() {
        return defaultLimit;
    }

    public void setDefaultLimit(int defaultLimit) {
        this.defaultLimit = defaultLimit;
    }

    public int getMaxLimit() {
        return maxLimit;
    }

    public void setMaxLimit(int maxLimit) {
        this.maxLimit = maxLimit;
    }

    public int getMinQueryLength() {
        return minQueryLength;
    }

    public void setMinQueryLength(int minQueryLength) {
        this.minQueryLength = minQueryLength;
    }

    public int getVectorBudgetMs() {
        return vectorBudgetMs;
    }

    public void setVectorBudgetMs(int vectorBudgetMs) {
        this.vectorBudgetMs = vectorBudgetMs;
    }
}
