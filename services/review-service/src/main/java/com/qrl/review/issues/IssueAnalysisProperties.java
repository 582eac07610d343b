package com.qrl.review.issues;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "review.issues")
public class IssueAnalysisProperties {
    private int badScoreThreshold = 90;
    private int windowDays = 21;
    private double similarityThreshold = 0.70;
    private long summaryDelayMs = 200;
    private int feedbackExcerptChars = 500;
    private boolean persistComputedEmbeddings = true;
    private boolean scheduleEnabled = true;
    private String scheduleCron = "0 0 6 * * MON";

    /** Scores strictly below this are bad. */
    public int getBadScoreThreshold() {
        return badScoreThreshold;
    }

    public void setBadScoreThreshold(int badScoreThreshold) {
        this.badScoreThreshold = badScoreThreshold;
    }

    public int getWindowDays() {
        return windowDays;
    }

    public void setWindowDays(int windowDays) {
        this.windowDays = windowDays;
    }

    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    public void setSimilarityThreshold(double similarityThreshold) {
        this.similarityThreshold = similarityThreshold;
    }

    public long getSummaryDelayMs() {
        return summaryDelayMs;
    }

    public void setSummaryDelayMs(long summaryDelayMs) {
        this.summaryDelayMs = summaryDelayMs;
    }

    public int getFeedbackExcerptChars() {
        return feedbackExcerptChars;
    }

    public void setFeedbackExcerptChars(int feedbackExcerptChars) {
        this.feedbackExcerptChars = feedbackExcerptChars;
    }

    public boolean isPersistComputedEmbeddings() {
        return persistComputedEmbeddings;
    }

    public void setPersistComputedEmbeddings(boolean persistComputedEmbeddings) {
        this.persistComputedEmbeddings = persistComputedEmbeddings;
    }

    public boolean isScheduleEnabled() {
        return scheduleEnabled;
    }

    public void setScheduleEnabled(boolean scheduleEnabled) {
        this.scheduleEnabled = scheduleEnabled;
    }

    public String getScheduleCron() {
        return scheduleCron;
    }

    public void setScheduleCron(String scheduleCron) {
        this.scheduleCron = scheduleCron;
    }
}
