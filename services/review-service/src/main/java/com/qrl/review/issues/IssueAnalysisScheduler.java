package com.qrl.review.issues;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class IssueAnalysisScheduler {
    private final IssueAnalysisService analysisService;
    private final IssueAnalysisProperties properties;

    public IssueAnalysisScheduler(IssueAnalysisService analysisService, IssueAnalysisProperties properties) {
        this.analysisService = analysisService;
        this.properties = properties;
    }

    @Scheduled(cron = "${review.issues.schedule-cron:0 0 6 * * MON}")
    public void analyzeAllAgents() {
        if (!properties.isScheduleEnabled()) {
            return;
        }
        analysisService.analyze(null);
    }
}
