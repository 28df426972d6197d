package com.purchasingpower.autoreview.model.review;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of anchoring one batch of suggestions against one diff.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnchoringResult {

    @Builder.Default
    private List<AnchoredComment> comments = new ArrayList<>();

    private ReviewVerdict verdict;

    private int filesParsed;
    private int received;
    private int filtered;
    private int duplicates;
    private int unresolved;

    @Builder.Default
    private Map<AnchorProvenance, Integer> provenanceCounts = new EnumMap<>(AnchorProvenance.class);

    /**
     * Share of posted anchors that needed correction or adjustment.
     * A rising value means the review prompt produces worse line claims.
     */
    public double getCorrectionRatio() {
        int corrected = provenanceCounts.getOrDefault(AnchorProvenance.CONTENT_CORRECTED, 0)
                + provenanceCounts.getOrDefault(AnchorProvenance.ADJUSTED, 0);
        return comments.isEmpty() ? 0.0 : (double) corrected / comments.size();
    }
}
