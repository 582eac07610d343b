package com.qrl.review.backfill;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "review.backfill")
public class BackfillProperties {
    private int batchSize = 10;
    private long batchDelayMs = 500;
    private int maxRecordsPerRun = 0;
    private int gradedWindowDays = 0;
    private boolean scheduleEnabled = false;
    private String scheduleCron = "0 30 2 * * *";

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public long getBatchDelayMs() {
        return batchDelayMs;
    }

    public void setBatchDelayMs(long batchDelayMs) {
        this.batchDelayMs = batchDelayMs;
    }

    /** 0 means no cap. */
    public int getMaxRecordsPerRun() {
        return maxRecordsPerRun;
    }

    public void setMaxRecordsPerRun(int maxRecordsPerRun) {
        this.maxRecordsPerRun = maxRecordsPerRun;
    }

    /** Only records graded within this many days; 0 means all. */
    public int getGradedWindowDays() {
        return gradedWindowDays;
    }

    public void setGradedWindowDays(int gradedWindowDays) {
        this.gradedWindowDays = gradedWindowDays;
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
