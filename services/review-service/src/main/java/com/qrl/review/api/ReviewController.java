package com.qrl.review.api;

import com.qrl.review.api.dto.ReviewResponse;
import com.qrl.review.api.dto.ReviewUpsertRequest;
import com.qrl.review.api.dto.SimilarReviewRequest;
import com.qrl.review.api.dto.SimilarReviewResponse;
import com.qrl.review.common.InvalidReviewRequestException;
import com.qrl.review.common.RequestIds;
import com.qrl.review.model.ConversationContent;
import com.qrl.review.model.ReviewContent;
import com.qrl.review.model.ReviewRecord;
import com.qrl.review.model.ReviewStatus;
import com.qrl.review.model.TicketContent;
import com.qrl.review.service.EmbeddingOutcome;
import com.qrl.review.service.ReviewRecordService;
import com.qrl.review.service.SimilarReviewQuery;
import com.qrl.review.service.SimilarReviewResult;
import com.qrl.review.service.SimilarReviewService;
import java.util.Locale;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ReviewController {
    private final ReviewRecordService reviewRecordService;
    private final SimilarReviewService similarReviewService;

    public ReviewController(ReviewRecordService reviewRecordService, SimilarReviewService similarReviewService) {
        this.reviewRecordService = reviewRecordService;
        this.similarReviewService = similarReviewService;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    @PostMapping("/api/v1/reviews")
    @ResponseStatus(HttpStatus.CREATED)
    public ReviewResponse createReview(@RequestBody ReviewUpsertRequest request) {
        return ReviewResponse.from(reviewRecordService.create(toRecord(request)));
    }

    @PutMapping("/api/v1/reviews/{reviewId}")
    public ReviewResponse updateReview(@PathVariable long reviewId, @RequestBody ReviewUpsertRequest request) {
        return ReviewResponse.from(reviewRecordService.update(reviewId, toRecord(request)));
    }

    @GetMapping("/api/v1/reviews/{reviewId}")
    public ReviewResponse getReview(@PathVariable long reviewId) {
        return ReviewResponse.from(reviewRecordService.get(reviewId));
    }

    @PostMapping("/api/v1/reviews/{reviewId}/embedding")
    public Map<String, Object> refreshEmbedding(@PathVariable long reviewId) {
        EmbeddingOutcome outcome = reviewRecordService.refreshEmbedding(reviewId);
        return Map.of("review_id", reviewId, "outcome", outcome.name().toLowerCase(Locale.ROOT));
    }

    @PostMapping("/api/v1/reviews/similar")
    public SimilarReviewResponse findSimilar(
        @RequestBody SimilarReviewRequest request,
        @RequestHeader(value = RequestIds.TRACE_HEADER, required = false) String traceIdHeader,
        @RequestHeader(value = RequestIds.REQUEST_HEADER, required = false) String requestIdHeader
    ) {
        RequestIds ids = RequestIds.resolve(traceIdHeader, requestIdHeader);
        SimilarReviewResult result = similarReviewService.findSimilar(new SimilarReviewQuery(
            request.getQuery(),
            request.getExcludeId(),
            request.getLimit(),
            request.getCategories()
        ));
        return SimilarReviewResponse.from(result, ids);
    }

    private ReviewRecord toRecord(ReviewUpsertRequest request) {
        if (request == null) {
            throw new InvalidReviewRequestException("request body is required");
        }
        return new ReviewRecord(
            null,
            request.getTicketNo(),
            request.getAgentId(),
            toContent(request),
            request.getQualityScore(),
            request.getCategories(),
            parseStatus(request.getStatus(), request.getQualityScore()),
            request.getGradedAt(),
            null,
            true
        );
    }

    private ReviewContent toContent(ReviewUpsertRequest request) {
        String kind = request.getKind() == null ? "ticket" : request.getKind().trim().toLowerCase(Locale.ROOT);
        return switch (kind) {
            case "ticket" -> new TicketContent(request.getNotes(), request.getFeedback(), request.getShortDescription());
            case "conversation" -> new ConversationContent(
                request.getNotes(),
                request.getFeedback(),
                request.getShortDescription(),
                request.getConversationExcerpt()
            );
            default -> throw new InvalidReviewRequestException("unknown review kind: " + request.getKind());
        };
    }

    private ReviewStatus parseStatus(String raw, Integer qualityScore) {
        if (raw == null || raw.isBlank()) {
            return qualityScore == null ? ReviewStatus.SELECTED : ReviewStatus.GRADED;
        }
        try {
            return ReviewStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new InvalidReviewRequestException("unknown review status: " + raw);
        }
    }
}
