package com.qrl.review.api;

import com.qrl.review.api.dto.BackfillResponse;
import com.qrl.review.api.dto.IssueAnalysisResponse;
import com.qrl.review.backfill.EmbeddingBackfillService;
import com.qrl.review.common.InvalidReviewRequestException;
import com.qrl.review.issues.IssueAnalysisService;
import com.qrl.review.model.BackfillMode;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AdminController {
    private final EmbeddingBackfillService backfillService;
    private final IssueAnalysisService issueAnalysisService;

    public AdminController(EmbeddingBackfillService backfillService, IssueAnalysisService issueAnalysisService) {
        this.backfillService = backfillService;
        this.issueAnalysisService = issueAnalysisService;
    }

    @PostMapping("/admin/embeddings/backfill")
    public BackfillResponse backfill(@RequestParam(value = "mode", required = false) String mode) {
        BackfillMode backfillMode;
        try {
            backfillMode = BackfillMode.fromValue(mode);
        } catch (IllegalArgumentException ex) {
            throw new InvalidReviewRequestException(ex.getMessage());
        }
        return BackfillResponse.from(backfillService.backfill(backfillMode));
    }

    @PostMapping("/admin/issues/analyze")
    public IssueAnalysisResponse analyzeIssues(@RequestParam(value = "agent_id", required = false) String agentId) {
        return IssueAnalysisResponse.from(issueAnalysisService.analyze(agentId));
    }
}
