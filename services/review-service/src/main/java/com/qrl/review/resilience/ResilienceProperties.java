package com.qrl.review.resilience;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "review.resilience")
public class ResilienceProperties {
    private int embedFailureThreshold = 5;
    private long embedOpenMs = 30000;
    private int summaryFailureThreshold = 5;
    private long summaryOpenMs = 60000;
    private int vectorFailureThreshold = 3;
    private long vectorOpenMs = 30000;

    public int getEmbedFailureThreshold() {
        return embedFailureThreshold;
    }

    public void setEmbedFailureThreshold(int embedFailureThreshold) {
        this.embedFailureThreshold = embedFailureThreshold;
    }

    public long getEmbedOpenMs() {
        return embedOpenMs;
    }

    public void setEmbedOpenMs(long embedOpenMs) {
        this.embedOpenMs = embedOpenMs;
    }

    public int getSummaryFailureThreshold() {
        return summaryFailureThreshold;
    }

    public void setSummaryFailureThreshold(int summaryFailureThreshold) {
        this.summaryFailureThreshold = summaryFailureThreshold;
    }

    public long getSummaryOpenMs() {
        return summaryOpenMs;
    }

    public void setSummaryOpenMs(long summaryOpenMs) {
        this.summaryOpenMs = summaryOpenMs;
    }

    public int getVectorFailureThreshold() {
        return vectorFailureThreshold;
    }

    public void setVectorFailureThreshold(int vectorFailureThreshold) {
        this.vectorFailureThreshold = vectorFailureThreshold;
    }

    public long getVectorOpenMs() {
        return vectorOpenMs;
    }

    public void setVectorOpenMs(long vectorOpenMs) {
        this.vectorOpenMs = vectorOpenMs;
    }
}
