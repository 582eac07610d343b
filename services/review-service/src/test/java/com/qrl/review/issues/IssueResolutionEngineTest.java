package com.qrl.review.issues;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.qrl.review.model.ReviewRecord;
import com.qrl.review.support.InMemoryReviewStore;
import com.qrl.review.support.Reviews;
import com.qrl.review.support.StubEmbeddingProvider;
import com.qrl.review.text.ReviewTextExtractor;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class IssueResolutionEngineTest {
    private InMemoryReviewStore store;
    private StubEmbeddingProvider provider;
    private IssueResolutionEngine engine;

    @BeforeEach
    void setUp() {
        store = new InMemoryReviewStore();
        provider = new StubEmbeddingProvider();
        engine = new IssueResolutionEngine(new IssueAnalysisProperties());
    }

    @Test
    void scoreBelowThresholdIsBad() {
        assertThat(engine.isBad(Reviews.graded(1L, "a1", 89, 1, "notes", "feedback"))).isTrue();
        assertThat(engine.isBad(Reviews.graded(2L, "a1", 90, 1, "notes", "feedback"))).isFalse();
    }

    @Test
    void laterGoodReviewInSameCategoryResolvesWithoutEmbedding() {
        ReviewRecord bad = Reviews.graded(1L, "a1", 60, 1, "Refund sent to wrong account", "Double-check IBAN", "Refunds");
        ReviewRecord good = Reviews.graded(2L, "a1", 95, 4, "Handled KYC reset", "Great", "KYC", "Refunds");

        Resolution resolution = engine.resolve(bad, List.of(good), cache());

        assertThat(resolution.path()).isEqualTo(ResolutionPath.CATEGORY);
        assertThat(resolution.resolvedBy()).isEqualTo(2L);
        assertThat(provider.calls()).isEmpty();
    }

    @Test
    void similarLaterGoodReviewResolvesByEmbedding() {
        ReviewRecord bad = Reviews.embedded(
            Reviews.graded(1L, "a1", 55, 1, "Agent skipped identity check", "Verify identity", "KYC"),
            List.of(1.0, 0.0));
        ReviewRecord good = Reviews.embedded(
            Reviews.graded(2L, "a1", 96, 6, "Agent verified identity carefully", "Well done", "Onboarding"),
            List.of(0.82, Math.sqrt(1 - 0.82 * 0.82)));

        Resolution resolution = engine.resolve(bad, List.of(good), cache());

        assertThat(resolution.path()).isEqualTo(ResolutionPath.EMBEDDING);
        assertThat(resolution.resolvedBy()).isEqualTo(2L);
        assertThat(resolution.similarity()).isCloseTo(0.82, within(1e-9));
        assertThat(provider.calls()).isEmpty();
    }

    @Test
    void dissimilarLaterGoodReviewLeavesIssueUnresolved() {
        ReviewRecord bad = Reviews.embedded(
            Reviews.graded(1L, "a1", 55, 1, "Agent skipped identity check", "Verify identity", "KYC"),
            List.of(1.0, 0.0));
        ReviewRecord good = Reviews.embedded(
            Reviews.graded(2L, "a1", 96, 6, "Refund processed on time", "Well done", "Refunds"),
            List.of(0.5, Math.sqrt(0.75)));

        assertThat(engine.resolve(bad, List.of(good), cache()).isResolved()).isFalse();
    }

    @Test
    void earlierGoodReviewNeverResolves() {
        ReviewRecord bad = Reviews.graded(1L, "a1", 60, 5, "Refund sent to wrong account", "Double-check", "Refunds");
        ReviewRecord earlier = Reviews.graded(2L, "a1", 95, 2, "Refund sent to wrong account", "Fixed", "Refunds");
        ReviewRecord sameDay = Reviews.graded(3L, "a1", 95, 5, "Refund sent to wrong account", "Fixed", "Refunds");

        Resolution resolution = engine.resolve(bad, List.of(earlier, sameDay), cache());

        assertThat(resolution).isEqualTo(Resolution.unresolved());
        assertThat(provider.calls()).isEmpty();
    }

    @Test
    void missingVectorsAreComputedOnceAndPersisted() {
        ReviewRecord bad = store.put(Reviews.graded(1L, "a1", 55, 1, "Agent skipped identity check", "Verify"));
        ReviewRecord first = store.put(Reviews.graded(2L, "a1", 95, 3, "Agent greeted customer", "Nice"));
        ReviewRecord second = store.put(Reviews.graded(3L, "a1", 95, 4, "Agent verified identity", "Good"));
        provider.vectorFor("Agent skipped identity check | Verify", List.of(1.0, 0.0, 0.0))
            .vectorFor("Agent greeted customer | Nice", List.of(0.0, 1.0, 0.0))
            .vectorFor("Agent verified identity | Good", List.of(0.9, 0.1, 0.0));
        RunEmbeddingCache cache = cache();

        Resolution resolution = engine.resolve(bad, List.of(second, first), cache);
        engine.resolve(bad, List.of(first), cache);

        assertThat(resolution.resolvedBy()).isEqualTo(3L);
        assertThat(cache.getComputedCount()).isEqualTo(3);
        assertThat(provider.calls()).hasSize(3);
        assertThat(store.raw(3L).hasFreshEmbedding()).isTrue();
    }

    @Test
    void embeddingFailureOnBadReviewLeavesItUnresolved() {
        ReviewRecord bad = Reviews.graded(1L, "a1", 55, 1, "Customer waited for callback", "Call back");
        ReviewRecord good = Reviews.embedded(
            Reviews.graded(2L, "a1", 95, 3, "Agent called back promptly", "Good"), List.of(1.0, 0.0, 0.0));
        provider.failWhenContains("callback");

        assertThat(engine.resolve(bad, List.of(good), cache()).isResolved()).isFalse();
    }

    private RunEmbeddingCache cache() {
        return new RunEmbeddingCache(provider, new ReviewTextExtractor(10), store, true);
    }
}
