package com.purchasingpower.autoreview.api;

import com.purchasingpower.autoreview.model.review.AnchoringResult;
import com.purchasingpower.autoreview.model.review.ReviewContext;
import com.purchasingpower.autoreview.service.ReviewAnchorService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for anchoring review suggestions onto a diff.
 *
 * @since 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/review")
@RequiredArgsConstructor
public class ReviewAnchorController {

    private final ReviewAnchorService reviewAnchorService;

    /**
     * Anchor suggestions.
     *
     * POST /api/v1/review/anchors
     */
    @PostMapping("/anchors")
    public ResponseEntity<AnchorResponse> anchor(@RequestBody AnchorRequest request) {
        try {
            if (request.getDiff() == null || request.getDiff().isBlank()) {
                return ResponseEntity.badRequest()
                    .body(AnchorResponse.error("Diff is required"));
            }

            int count = request.getSuggestions() != null ? request.getSuggestions().size() : 0;
            log.info("Anchoring {} suggestion(s), strict={}", count, request.getStrict());

            AnchoringResult result = request.getStrict() != null
                ? reviewAnchorService.anchor(request.getDiff(), request.getSuggestions(),
                    request.getExistingComments(), request.getStrict())
                : reviewAnchorService.anchor(request.getDiff(), request.getSuggestions(),
                    request.getExistingComments());

            return ResponseEntity.ok(AnchorResponse.success(result));

        } catch (Exception e) {
            log.error("Anchoring failed", e);
            return ResponseEntity.internalServerError()
                .body(AnchorResponse.error("Anchoring failed: " + e.getMessage()));
        }
    }

    /**
     * Line mapping report.
     *
     * POST /api/v1/review/report
     */
    @PostMapping("/report")
    public ResponseEntity<ReportResponse> report(@RequestBody ReportRequest request) {
        try {
            if (request.getDiff() == null || request.getDiff().isBlank()) {
                return ResponseEntity.badRequest()
                    .body(ReportResponse.error("Diff is required"));
            }
            return ResponseEntity.ok(ReportResponse.success(reviewAnchorService.mappingReport(request.getDiff())));

        } catch (Exception e) {
            log.error("Report generation failed", e);
            return ResponseEntity.internalServerError()
                .body(ReportResponse.error("Report generation failed: " + e.getMessage()));
        }
    }

    /**
     * Render the review prompt for a diff.
     *
     * POST /api/v1/review/prompt
     */
    @PostMapping("/prompt")
    public ResponseEntity<PromptResponse> prompt(@RequestBody PromptRequest request) {
        try {
            if (request.getDiff() == null || request.getDiff().isBlank()) {
                return ResponseEntity.badRequest()
                    .body(PromptResponse.error("Diff is required"));
            }
            ReviewContext context = ReviewContext.builder()
                .title(request.getTitle())
                .description(request.getDescription())
                .build();
            return ResponseEntity.ok(PromptResponse.success(reviewAnchorService.reviewPrompt(request.getDiff(), context)));

        } catch (Exception e) {
            log.error("Prompt rendering failed", e);
            return ResponseEntity.internalServerError()
                .body(PromptResponse.error("Prompt rendering failed: " + e.getMessage()));
        }
    }
}
