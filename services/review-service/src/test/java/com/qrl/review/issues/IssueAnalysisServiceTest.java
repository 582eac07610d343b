package com.qrl.review.issues;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.qrl.review.common.AgentNotFoundException;
import com.qrl.review.model.AgentIssueEntry;
import com.qrl.review.model.ReviewRecord;
import com.qrl.review.model.ReviewStatus;
import com.qrl.review.model.TicketContent;
import com.qrl.review.summary.SummaryProvider;
import com.qrl.review.summary.SummaryUnavailableException;
import com.qrl.review.support.InMemoryAgentDirectory;
import com.qrl.review.support.InMemoryIssueStore;
import com.qrl.review.support.InMemoryReviewStore;
import com.qrl.review.support.RecordingSleeper;
import com.qrl.review.support.Reviews;
import com.qrl.review.support.StubEmbeddingProvider;
import com.qrl.review.text.ReviewTextExtractor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class IssueAnalysisServiceTest {
    private static final Instant NOW = Reviews.day(20);

    private InMemoryReviewStore store;
    private InMemoryIssueStore issueStore;
    private InMemoryAgentDirectory agents;
    private StubEmbeddingProvider provider;
    private IssueAnalysisProperties properties;
    private RecordingSleeper sleeper;
    private SummaryProvider summaryProvider;

    @BeforeEach
    void setUp() {
        store = new InMemoryReviewStore();
        issueStore = new InMemoryIssueStore();
        agents = new InMemoryAgentDirectory().add("a1", "Ana Petrovic").add("a2", "Marko Ilic");
        provider = new StubEmbeddingProvider();
        properties = new IssueAnalysisProperties();
        sleeper = new RecordingSleeper();
        summaryProvider = record -> "Skipped identity verification before account change.";
    }

    @Test
    void unresolvedBadReviewBecomesIssueWithSummary() {
        store.put(Reviews.graded(1L, "a1", 60, 1, "Refund sent to wrong account", "Double-check IBAN", "Refunds"));
        store.put(Reviews.graded(2L, "a1", 95, 3, "Refund handled correctly", "Great", "Refunds"));
        store.put(Reviews.embedded(
            Reviews.graded(3L, "a1", 50, 5, "Agent skipped identity check", "Always verify identity first", "KYC"),
            List.of(1.0, 0.0, 0.0)));
        store.put(Reviews.embedded(
            Reviews.graded(4L, "a1", 92, 1, "Agent verified identity", "Good", "KYC"), List.of(1.0, 0.0, 0.0)));

        AgentIssueReport report = service().analyzeAgent("a1", NOW);

        assertThat(report.badCount()).isEqualTo(2);
        assertThat(report.unresolvedCount()).isEqualTo(1);
        assertThat(report.resolvedByCategory()).isEqualTo(1);
        List<AgentIssueEntry> issues = issueStore.findByAgent("a1");
        assertThat(issues).hasSize(1);
        AgentIssueEntry entry = issues.get(0);
        assertThat(entry.reviewId()).isEqualTo(3L);
        assertThat(entry.ticketNo()).isEqualTo("T-3");
        assertThat(entry.summary()).isNotBlank();
        assertThat(entry.feedbackExcerpt()).isEqualTo("Always verify identity first");
        assertThat(entry.resolved()).isFalse();
        assertThat(issueStore.lastAnalyzed("a1")).isEqualTo(NOW);
    }

    @Test
    void reviewsOutsideWindowAreIgnored() {
        store.put(Reviews.graded(1L, "a1", 40, 1, "Agent was rude to customer", "Stay polite"));

        AgentIssueReport report = service().analyzeAgent("a1", Reviews.day(40));

        assertThat(report.badCount()).isZero();
        assertThat(issueStore.findByAgent("a1")).isEmpty();
    }

    @Test
    void rerunReplacesPreviousIssueList() {
        store.put(Reviews.graded(1L, "a1", 60, 1, "Refund sent to wrong account", "Double-check IBAN", "Refunds"));
        IssueAnalysisService service = service();
        service.analyzeAgent("a1", NOW);
        assertThat(issueStore.findByAgent("a1")).hasSize(1);

        store.put(Reviews.graded(2L, "a1", 97, 8, "Refund handled correctly", "Great", "Refunds"));
        service.analyzeAgent("a1", NOW);

        assertThat(issueStore.findByAgent("a1")).isEmpty();
    }

    @Test
    void summaryFailureFallsBackToPlaceholder() {
        summaryProvider = record -> {
            throw new SummaryUnavailableException("summary_http_503");
        };
        store.put(Reviews.graded(1L, "a1", 60, 1, "Refund sent to wrong account", "Double-check IBAN", "Refunds"));

        AgentIssueReport report = service().analyzeAgent("a1", NOW);

        assertThat(report.summaryFailures()).isEqualTo(1);
        assertThat(issueStore.findByAgent("a1")).extracting(AgentIssueEntry::summary)
            .containsExactly(SummaryProvider.FALLBACK_SUMMARY);
    }

    @Test
    void summaryCallsArePaced() {
        properties.setSummaryDelayMs(200);
        store.put(Reviews.graded(1L, "a1", 60, 1, "Refund sent to wrong account", "Double-check", "Refunds"));
        store.put(Reviews.graded(2L, "a1", 70, 2, "Customer waited on hold", "Use callbacks", "Hold"));
        store.put(Reviews.graded(3L, "a1", 65, 3, "Wrong macro applied", "Read the macro", "Macros"));

        service().analyzeAgent("a1", NOW);

        assertThat(sleeper.sleeps()).hasSize(2);
    }

    @Test
    void oneFailingAgentDoesNotStopTheRun() {
        Instant now = Instant.now();
        store = new InMemoryReviewStore() {
            @Override
            public synchronized List<ReviewRecord> findGradedForAgent(String agentId, Instant gradedFrom) {
                if ("a2".equals(agentId)) {
                    throw new IllegalStateException("connection reset");
                }
                return super.findGradedForAgent(agentId, gradedFrom);
            }
        };
        agents.addRemoved("a3", "Former Agent");
        store.put(recent(1L, "a1", 60, now.minus(Duration.ofDays(2))));
        store.put(recent(2L, "a3", 10, now.minus(Duration.ofDays(2))));

        IssueAnalysisReport report = service().analyze(null);

        assertThat(report.agentsAnalyzed()).isEqualTo(2);
        assertThat(report.failedAgents()).isEqualTo(1);
        assertThat(report.unresolvedCount()).isEqualTo(1);
        assertThat(report.agents()).extracting(AgentIssueReport::agentId).containsExactly("a1", "a2");
        assertThat(issueStore.findByAgent("a1")).hasSize(1);
        assertThat(issueStore.lastAnalyzed("a3")).isNull();
    }

    @Test
    void unknownAgentIsRejected() {
        assertThatThrownBy(() -> service().analyze("ghost")).isInstanceOf(AgentNotFoundException.class);
    }

    private IssueAnalysisService service() {
        return new IssueAnalysisService(
            store,
            issueStore,
            agents,
            new IssueResolutionEngine(properties),
            provider,
            summaryProvider,
            new ReviewTextExtractor(10),
            properties,
            sleeper,
            new SimpleMeterRegistry()
        );
    }

    private static ReviewRecord recent(long id, String agentId, int score, Instant gradedAt) {
        return new ReviewRecord(id, "T-" + id, agentId,
            new TicketContent("Agent skipped identity check", "Verify identity first", null),
            score, List.of("KYC"), ReviewStatus.GRADED, gradedAt, null, true);
    }
}
