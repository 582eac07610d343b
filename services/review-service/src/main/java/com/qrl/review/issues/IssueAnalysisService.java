package com.qrl.review.issues;

import com.qrl.review.common.AgentNotFoundException;
import com.qrl.review.common.ProviderUnavailableException;
import com.qrl.review.embed.EmbeddingProvider;
import com.qrl.review.execution.FixedIntervalGate;
import com.qrl.review.execution.Sleeper;
import com.qrl.review.model.Agent;
import com.qrl.review.model.AgentIssueEntry;
import com.qrl.review.model.ReviewRecord;
import com.qrl.review.store.AgentDirectory;
import com.qrl.review.store.IssueStore;
import com.qrl.review.store.ReviewStore;
import com.qrl.review.summary.SummaryProvider;
import com.qrl.review.text.ReviewTextExtractor;
import com.qrl.review.text.TextNormalizer;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Recomputes each agent's unresolved issue list over the trailing window and
 * replaces the stored list wholesale.
 */
@Service
public class IssueAnalysisService {
    private static final Logger logger = LoggerFactory.getLogger(IssueAnalysisService.class);

    private final ReviewStore reviewStore;
    private final IssueStore issueStore;
    private final AgentDirectory agentDirectory;
    private final IssueResolutionEngine resolutionEngine;
    private final EmbeddingProvider embeddingProvider;
    private final SummaryProvider summaryProvider;
    private final ReviewTextExtractor textExtractor;
    private final IssueAnalysisProperties properties;
    private final Sleeper sleeper;
    private final MeterRegistry meterRegistry;

    public IssueAnalysisService(
        ReviewStore reviewStore,
        IssueStore issueStore,
        AgentDirectory agentDirectory,
        IssueResolutionEngine resolutionEngine,
        EmbeddingProvider embeddingProvider,
        SummaryProvider summaryProvider,
        ReviewTextExtractor textExtractor,
        IssueAnalysisProperties properties,
        Sleeper sleeper,
        MeterRegistry meterRegistry
    ) {
        this.reviewStore = reviewStore;
        this.issueStore = issueStore;
        this.agentDirectory = agentDirectory;
        this.resolutionEngine = resolutionEngine;
        this.embeddingProvider = embeddingProvider;
        this.summaryProvider = summaryProvider;
        this.textExtractor = textExtractor;
        this.properties = properties;
        this.sleeper = sleeper;
        this.meterRegistry = meterRegistry;
    }

    /** Analyzes one agent, or every active agent when {@code agentId} is null. */
    public IssueAnalysisReport analyze(String agentId) {
        Instant now = Instant.now();
        if (agentId != null && !agentId.isBlank()) {
            Agent agent = agentDirectory.findById(agentId).orElseThrow(() -> new AgentNotFoundException(agentId));
            return IssueAnalysisReport.of(List.of(analyzeAgent(agent.id(), now)));
        }

        List<Agent> agents = agentDirectory.listActiveAgents();
        logger.info("issue_analysis_start agents={} window_days={}", agents.size(), properties.getWindowDays());
        List<AgentIssueReport> reports = new ArrayList<>(agents.size());
        for (Agent agent : agents) {
            try {
                reports.add(analyzeAgent(agent.id(), now));
            } catch (RuntimeException ex) {
                meterRegistry.counter("review.issues.agents.total", "outcome", "failed").increment();
                logger.warn("issue_analysis_agent_failed agent_id={} message={}", agent.id(), ex.getMessage());
                reports.add(AgentIssueReport.failed(agent.id(), ex.getMessage()));
            }
        }
        IssueAnalysisReport report = IssueAnalysisReport.of(reports);
        logger.info(
            "issue_analysis_done agents={} bad={} unresolved={} failed_agents={}",
            report.agentsAnalyzed(),
            report.badCount(),
            report.unresolvedCount(),
            report.failedAgents()
        );
        return report;
    }

    AgentIssueReport analyzeAgent(String agentId, Instant now) {
        Instant windowStart = now.minus(Duration.ofDays(properties.getWindowDays()));
        List<ReviewRecord> bad = new ArrayList<>();
        List<ReviewRecord> good = new ArrayList<>();
        for (ReviewRecord record : reviewStore.findGradedForAgent(agentId, windowStart)) {
            if (!record.isGraded()) {
                continue;
            }
            if (resolutionEngine.isBad(record)) {
                bad.add(record);
            } else {
                good.add(record);
            }
        }

        if (bad.isEmpty()) {
            issueStore.replaceIssues(agentId, List.of(), now);
            meterRegistry.counter("review.issues.agents.total", "outcome", "clean").increment();
            return new AgentIssueReport(agentId, 0, 0, 0, 0, 0, null);
        }

        RunEmbeddingCache embeddings = new RunEmbeddingCache(
            embeddingProvider,
            textExtractor,
            reviewStore,
            properties.isPersistComputedEmbeddings()
        );
        FixedIntervalGate summaryGate = new FixedIntervalGate(properties.getSummaryDelayMs(), sleeper);
        List<AgentIssueEntry> entries = new ArrayList<>();
        int byCategory = 0;
        int byEmbedding = 0;
        int summaryFailures = 0;

        for (ReviewRecord record : bad) {
            Resolution resolution = resolutionEngine.resolve(record, good, embeddings);
            if (resolution.path() == ResolutionPath.CATEGORY) {
                byCategory++;
                continue;
            }
            if (resolution.path() == ResolutionPath.EMBEDDING) {
                byEmbedding++;
                continue;
            }
            awaitSummarySlot(summaryGate);
            String summary;
            try {
                summary = summaryProvider.summarize(record);
            } catch (ProviderUnavailableException ex) {
                summaryFailures++;
                logger.warn("issue_summary_failed review_id={} reason={}", record.id(), ex.getReason());
                summary = SummaryProvider.FALLBACK_SUMMARY;
            }
            if (summary == null || summary.isBlank()) {
                summary = SummaryProvider.FALLBACK_SUMMARY;
            }
            entries.add(new AgentIssueEntry(
                agentId,
                record.id(),
                record.ticketNo(),
                record.categories(),
                record.qualityScore(),
                record.gradedAt(),
                summary,
                excerpt(record.content().feedback()),
                false,
                now
            ));
        }

        issueStore.replaceIssues(agentId, entries, now);
        meterRegistry.counter("review.issues.agents.total", "outcome", "analyzed").increment();
        meterRegistry.counter("review.issues.unresolved.total").increment(entries.size());
        logger.info(
            "issue_analysis_agent agent_id={} bad={} unresolved={} by_category={} by_embedding={} embeddings_computed={}",
            agentId,
            bad.size(),
            entries.size(),
            byCategory,
            byEmbedding,
            embeddings.getComputedCount()
        );
        return new AgentIssueReport(agentId, bad.size(), entries.size(), byCategory, byEmbedding, summaryFailures, null);
    }

    private void awaitSummarySlot(FixedIntervalGate gate) {
        try {
            gate.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("issue analysis interrupted", e);
        }
    }

    private String excerpt(String feedback) {
        String text = TextNormalizer.normalize(feedback);
        int max = properties.getFeedbackExcerptChars();
        return max > 0 && text.length() > max ? text.substring(0, max) : text;
    }
}
