package com.qrl.review.service;

import com.qrl.review.merge.ScoreFusion;
import com.qrl.review.model.Agent;
import com.qrl.review.model.CandidateResult;
import com.qrl.review.model.ReviewRecord;
import com.qrl.review.resilience.CircuitBreaker;
import com.qrl.review.resilience.ReviewResilienceRegistry;
import com.qrl.review.retrieval.CandidateQuery;
import com.qrl.review.retrieval.KeywordCandidateFinder;
import com.qrl.review.retrieval.SimilarityProperties;
import com.qrl.review.retrieval.VectorCandidateFinder;
import com.qrl.review.retrieval.VectorSearch;
import com.qrl.review.store.AgentDirectory;
import com.qrl.review.store.ReviewStore;
import com.qrl.review.text.TextNormalizer;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Hybrid "find similar reviews": keyword leg inline, vector leg on the search
 * executor under a time budget. Any vector-leg trouble degrades to keyword-only.
 */
@Service
public class SimilarReviewService {
    public static final String NO_MATCHES_MESSAGE = "No similar reviews found";

    private static final Logger logger = LoggerFactory.getLogger(SimilarReviewService.class);

    private final KeywordCandidateFinder keywordFinder;
    private final VectorCandidateFinder vectorFinder;
    private final ReviewStore reviewStore;
    private final AgentDirectory agentDirectory;
    private final SimilarityProperties properties;
    private final ReviewResilienceRegistry resilienceRegistry;
    private final ExecutorService searchExecutor;
    private final MeterRegistry meterRegistry;

    public SimilarReviewService(
        KeywordCandidateFinder keywordFinder,
        VectorCandidateFinder vectorFinder,
        ReviewStore reviewStore,
        AgentDirectory agentDirectory,
        SimilarityProperties properties,
        ReviewResilienceRegistry resilienceRegistry,
        @Qualifier("reviewSearchExecutor") ExecutorService searchExecutor,
        MeterRegistry meterRegistry
    ) {
        this.keywordFinder = keywordFinder;
        this.vectorFinder = vectorFinder;
        this.reviewStore = reviewStore;
        this.agentDirectory = agentDirectory;
        this.properties = properties;
        this.resilienceRegistry = resilienceRegistry;
        this.searchExecutor = searchExecutor;
        this.meterRegistry = meterRegistry;
    }

    public List<CandidateResult> findSimilar(String queryText, Long excludeId, Integer limit) {
        return findSimilar(SimilarReviewQuery.of(queryText, excludeId, limit)).candidates();
    }

    public SimilarReviewResult findSimilar(SimilarReviewQuery query) {
        long started = System.currentTimeMillis();
        String text = TextNormalizer.normalize(query.text());
        if (text.length() < properties.getMinQueryLength()) {
            return new SimilarReviewResult(List.of(), List.of(), "skipped", NO_MATCHES_MESSAGE, 0L);
        }
        int limit = resolveLimit(query.limit());
        Set<Long> exclude = new HashSet<>();
        if (query.excludeId() != null) {
            exclude.add(query.excludeId());
        }

        List<CandidateResult> keyword = keywordFinder.find(new CandidateQuery(text, exclude, query.categories()));

        Set<Long> vectorExclude = new HashSet<>(exclude);
        for (CandidateResult candidate : keyword) {
            vectorExclude.add(candidate.documentId());
        }
        VectorLeg vectorLeg = runVectorLeg(new CandidateQuery(text, vectorExclude, query.categories()));

        List<CandidateResult> fused = ScoreFusion.fuse(keyword, vectorLeg.results(), limit);
        List<SimilarReviewHit> hits = describe(fused);
        long tookMs = System.currentTimeMillis() - started;

        meterRegistry.counter("review.similar.requests", "vector", vectorLeg.status()).increment();
        logger.info(
            "similar_reviews_done keyword={} vector={} vector_status={} returned={} took_ms={}",
            keyword.size(),
            vectorLeg.results().size(),
            vectorLeg.status(),
            fused.size(),
            tookMs
        );
        return new SimilarReviewResult(fused, hits, vectorLeg.status(), fused.isEmpty() ? NO_MATCHES_MESSAGE : null, tookMs);
    }

    private VectorLeg runVectorLeg(CandidateQuery query) {
        CircuitBreaker breaker = resilienceRegistry.getVectorBreaker();
        if (!breaker.allowRequest()) {
            return new VectorLeg(List.of(), "circuit_open");
        }
        CompletableFuture<VectorSearch> future =
            CompletableFuture.supplyAsync(() -> vectorFinder.search(query), searchExecutor);
        try {
            VectorSearch search = future.get(Math.max(1, properties.getVectorBudgetMs()), TimeUnit.MILLISECONDS);
            if (search.hasFailed()) {
                breaker.recordFailure();
                return new VectorLeg(List.of(), "error");
            }
            breaker.recordSuccess();
            return new VectorLeg(search.candidates(), "ok");
        } catch (TimeoutException e) {
            // the in-flight provider call is left to finish on its own
            breaker.recordFailure();
            logger.warn("similar_vector_timeout budget_ms={}", properties.getVectorBudgetMs());
            return new VectorLeg(List.of(), "timeout");
        } catch (ExecutionException e) {
            breaker.recordFailure();
            Throwable cause = e.getCause() == null ? e : e.getCause();
            logger.warn("similar_vector_error message={}", cause.getMessage());
            return new VectorLeg(List.of(), "error");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new VectorLeg(List.of(), "error");
        }
    }

    private List<SimilarReviewHit> describe(List<CandidateResult> candidates) {
        if (candidates.isEmpty()) {
            return List.of();
        }
        List<Long> ids = new ArrayList<>(candidates.size());
        for (CandidateResult candidate : candidates) {
            ids.add(candidate.documentId());
        }
        Map<Long, ReviewRecord> records = new HashMap<>();
        Set<String> agentIds = new LinkedHashSet<>();
        for (ReviewRecord record : reviewStore.findByIds(ids)) {
            records.put(record.id(), record);
            if (record.agentId() != null) {
                agentIds.add(record.agentId());
            }
        }
        Map<String, Agent> agents = agentDirectory.findByIds(agentIds);

        List<SimilarReviewHit> hits = new ArrayList<>(candidates.size());
        for (CandidateResult candidate : candidates) {
            ReviewRecord record = records.get(candidate.documentId());
            Agent agent = record == null ? null : agents.get(record.agentId());
            hits.add(new SimilarReviewHit(
                candidate.documentId(),
                candidate.score(),
                candidate.matchType(),
                record == null ? null : record.ticketNo(),
                record == null ? null : record.agentId(),
                agent == null ? null : agent.name(),
                record == null ? null : record.qualityScore(),
                record == null ? List.of() : record.categories(),
                record == null ? null : record.gradedAt()
            ));
        }
        return hits;
    }

    private int resolveLimit(Integer requested) {
        if (requested == null || requested <= 0) {
            return properties.getDefaultLimit();
        }
        return Math.min(requested, properties.getMaxLimit());
    }

    private record VectorLeg(List<CandidateResult> results, String status) {
    }
}
