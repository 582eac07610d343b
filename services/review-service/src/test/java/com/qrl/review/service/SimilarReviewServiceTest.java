package com.qrl.review.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.qrl.review.model.CandidateResult;
import com.qrl.review.model.MatchType;
import com.qrl.review.resilience.ResilienceProperties;
import com.qrl.review.resilience.ReviewResilienceRegistry;
import com.qrl.review.retrieval.CandidateQuery;
import com.qrl.review.retrieval.KeywordCandidateFinder;
import com.qrl.review.retrieval.SimilarityProperties;
import com.qrl.review.retrieval.VectorCandidateFinder;
import com.qrl.review.retrieval.VectorSearch;
import com.qrl.review.support.InMemoryAgentDirectory;
import com.qrl.review.support.InMemoryReviewStore;
import com.qrl.review.support.Reviews;
import com.qrl.review.support.StubEmbeddingProvider;
import com.qrl.review.text.KeywordExtractor;
import com.qrl.review.text.ReviewTextExtractor;
import com.qrl.review.text.StopWordList;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

class SimilarReviewServiceTest {
    private static final String QUERY = "refund delayed chargeback";

    private final ExecutorService executor = Executors.newFixedThreadPool(2);
    private InMemoryReviewStore store;
    private InMemoryAgentDirectory agents;
    private SimilarityProperties properties;
    private ResilienceProperties resilienceProperties;
    private KeywordCandidateFinder keywordFinder;
    private VectorCandidateFinder vectorFinder;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        ReviewTextExtractor textExtractor = new ReviewTextExtractor(10);
        store = new InMemoryReviewStore(textExtractor);
        agents = new InMemoryAgentDirectory().add("a1", "Ana Petrovic").add("a2", "Marko Ilic");
        properties = new SimilarityProperties();
        resilienceProperties = new ResilienceProperties();
        meterRegistry = new SimpleMeterRegistry();
        KeywordExtractor keywordExtractor = new KeywordExtractor(
            StopWordList.load(new ClassPathResource("text/stopwords.txt"), List.of()), 3, 15);
        keywordFinder = new KeywordCandidateFinder(store, keywordExtractor, textExtractor, properties);
        vectorFinder = new VectorCandidateFinder(
            store, new StubEmbeddingProvider(), textExtractor, properties, meterRegistry);

        store.put(Reviews.embedded(
            Reviews.graded(1L, "a1", 55, 1, "refund delayed chargeback opened", "Escalate to billing"),
            List.of(1.0, 0.0, 0.0)));
        store.put(Reviews.embedded(
            Reviews.graded(2L, "a2", 60, 2, "customer disputed card payment", "Explain the dispute window"),
            List.of(1.0, 0.0, 0.0)));
        store.put(Reviews.embedded(
            Reviews.graded(3L, "a1", 40, 3, "refund delayed chargeback again", "Same as before"),
            List.of(1.0, 0.0, 0.0)));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void fusesKeywordAndVectorHitsWithoutDuplicates() {
        SimilarReviewResult result = service(vectorFinder).findSimilar(SimilarReviewQuery.of(QUERY, 3L, null));

        assertThat(result.vectorStatus()).isEqualTo("ok");
        assertThat(result.message()).isNull();
        assertThat(result.candidates()).containsExactly(
            new CandidateResult(1L, 100, MatchType.KEYWORD),
            new CandidateResult(2L, 100, MatchType.EMBEDDING)
        );
        assertThat(result.hits()).extracting(SimilarReviewHit::agentName).containsExactly("Ana Petrovic", "Marko Ilic");
        assertThat(result.hits().get(1).ticketNo()).isEqualTo("T-2");
    }

    @Test
    void excludedRecordIsNeverReturned() {
        List<CandidateResult> candidates = service(vectorFinder).findSimilar(QUERY, 1L, 10);

        assertThat(candidates).extracting(CandidateResult::documentId).doesNotContain(1L).doesNotHaveDuplicates();
    }

    @Test
    void shortQueryReturnsNeutralMessage() {
        VectorCandidateFinder mocked = mock(VectorCandidateFinder.class);

        SimilarReviewResult result = service(mocked).findSimilar(SimilarReviewQuery.of("  refund ", null, null));

        assertThat(result.candidates()).isEmpty();
        assertThat(result.vectorStatus()).isEqualTo("skipped");
        assertThat(result.message()).isEqualTo(SimilarReviewService.NO_MATCHES_MESSAGE);
        verify(mocked, never()).search(any());
    }

    @Test
    void noMatchesCarriesMessage() {
        VectorCandidateFinder mocked = mock(VectorCandidateFinder.class);
        when(mocked.search(any(CandidateQuery.class))).thenReturn(VectorSearch.of(List.of()));

        SimilarReviewResult result = service(mocked).findSimilar(
            SimilarReviewQuery.of("password reset loop on mobile", null, null));

        assertThat(result.candidates()).isEmpty();
        assertThat(result.message()).isEqualTo(SimilarReviewService.NO_MATCHES_MESSAGE);
    }

    @Test
    void slowVectorLegDegradesToKeywordOnly() {
        properties.setVectorBudgetMs(50);
        VectorCandidateFinder slow = mock(VectorCandidateFinder.class);
        when(slow.search(any(CandidateQuery.class))).thenAnswer(invocation -> {
            Thread.sleep(1000);
            return VectorSearch.of(List.of(new CandidateResult(2L, 90, MatchType.EMBEDDING)));
        });

        SimilarReviewResult result = service(slow).findSimilar(SimilarReviewQuery.of(QUERY, null, null));

        assertThat(result.vectorStatus()).isEqualTo("timeout");
        assertThat(result.candidates()).extracting(CandidateResult::matchType).containsOnly(MatchType.KEYWORD);
        assertThat(result.candidates()).extracting(CandidateResult::documentId).containsExactly(1L, 3L);
    }

    @Test
    void failingVectorLegDegradesAndEventuallyOpensCircuit() {
        resilienceProperties.setVectorFailureThreshold(1);
        VectorCandidateFinder broken = mock(VectorCandidateFinder.class);
        when(broken.search(any(CandidateQuery.class))).thenThrow(new IllegalStateException("pool exhausted"));
        SimilarReviewService service = service(broken);

        SimilarReviewResult first = service.findSimilar(SimilarReviewQuery.of(QUERY, null, null));
        SimilarReviewResult second = service.findSimilar(SimilarReviewQuery.of(QUERY, null, null));

        assertThat(first.vectorStatus()).isEqualTo("error");
        assertThat(first.candidates()).hasSize(2);
        assertThat(second.vectorStatus()).isEqualTo("circuit_open");
        assertThat(second.candidates()).hasSize(2);
    }

    @Test
    void providerFailureOnVectorLegTripsBreaker() {
        resilienceProperties.setVectorFailureThreshold(1);
        StubEmbeddingProvider failing = new StubEmbeddingProvider().failWhenContains("chargeback");
        SimilarReviewService service = service(new VectorCandidateFinder(
            store, failing, new ReviewTextExtractor(10), properties, meterRegistry));

        SimilarReviewResult first = service.findSimilar(SimilarReviewQuery.of(QUERY, null, null));
        SimilarReviewResult second = service.findSimilar(SimilarReviewQuery.of(QUERY, null, null));

        assertThat(first.vectorStatus()).isEqualTo("error");
        assertThat(first.candidates()).extracting(CandidateResult::matchType).containsOnly(MatchType.KEYWORD);
        assertThat(second.vectorStatus()).isEqualTo("circuit_open");
        assertThat(failing.calls()).hasSize(1);
        assertThat(meterRegistry.counter("review.similar.requests", "vector", "error").count()).isEqualTo(1.0);
    }

    @Test
    void categoriesNarrowBothLegs() {
        store.put(Reviews.embedded(
            Reviews.graded(4L, "a2", 70, 4, "card declined at checkout", "Retry with another card", "KYC"),
            List.of(1.0, 0.0, 0.0)));
        store.put(Reviews.embedded(
            Reviews.graded(5L, "a2", 75, 5, "invoice sent to wrong address", "Confirm the address", "Billing"),
            List.of(1.0, 0.0, 0.0)));

        SimilarReviewResult result = service(vectorFinder).findSimilar(
            new SimilarReviewQuery(QUERY, null, null, List.of("Billing")));

        assertThat(result.vectorStatus()).isEqualTo("ok");
        assertThat(result.candidates()).extracting(CandidateResult::documentId).containsExactly(5L);
        assertThat(result.candidates()).extracting(CandidateResult::matchType).containsOnly(MatchType.EMBEDDING);
    }

    @Test
    void vectorLegNeverSeesKeywordOrExcludedIds() {
        VectorCandidateFinder mocked = mock(VectorCandidateFinder.class);
        when(mocked.search(any(CandidateQuery.class))).thenAnswer(invocation -> {
            CandidateQuery query = invocation.getArgument(0);
            assertThat(query.excludeIds()).isEqualTo(Set.of(1L, 3L, 99L));
            return VectorSearch.of(List.of(new CandidateResult(2L, 70, MatchType.EMBEDDING)));
        });

        SimilarReviewResult result = service(mocked).findSimilar(SimilarReviewQuery.of(QUERY, 99L, null));

        assertThat(result.vectorStatus()).isEqualTo("ok");
        assertThat(result.candidates()).extracting(CandidateResult::documentId).containsExactly(1L, 3L, 2L);
    }

    @Test
    void limitIsCappedAndDefaulted() {
        properties.setMaxLimit(1);

        List<CandidateResult> capped = service(vectorFinder).findSimilar(QUERY, null, 25);

        assertThat(capped).hasSize(1);
    }

    private SimilarReviewService service(VectorCandidateFinder vector) {
        return new SimilarReviewService(
            keywordFinder,
            vector,
            store,
            agents,
            properties,
            new ReviewResilienceRegistry(resilienceProperties),
            executor,
            meterRegistry
        );
    }
}
