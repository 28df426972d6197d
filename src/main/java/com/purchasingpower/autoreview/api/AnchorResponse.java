package com.purchasingpower.autoreview.api;

import com.purchasingpower.autoreview.model.review.AnchorProvenance;
import com.purchasingpower.autoreview.model.review.AnchoredComment;
import com.purchasingpower.autoreview.model.review.AnchoringResult;
import com.purchasingpower.autoreview.model.review.ReviewVerdict;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Anchoring response.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnchorResponse {

    private boolean success;
    private String error;
    private ReviewVerdict verdict;

    @Builder.Default
    private List<AnchoredComment> comments = new ArrayList<>();

    private Stats stats;

    public static AnchorResponse success(AnchoringResult result) {
        return AnchorResponse.builder()
            .success(true)
            .verdict(result.getVerdict())
            .comments(result.getComments())
            .stats(Stats.builder()
                .filesParsed(result.getFilesParsed())
                .received(result.getReceived())
                .filtered(result.getFiltered())
                .duplicates(result.getDuplicates())
                .unresolved(result.getUnresolved())
                .provenance(result.getProvenanceCounts())
                .correctionRatio(result.getCorrectionRatio())
                .build())
            .build();
    }

    public static AnchorResponse error(String error) {
        return AnchorResponse.builder()
            .success(false)
            .error(error)
            .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Stats {
        private int filesParsed;
        private int received;
        private int filtered;
        private int duplicates;
        private int unresolved;
        private Map<AnchorProvenance, Integer> provenance;
        private double correctionRatio;
    }
}
