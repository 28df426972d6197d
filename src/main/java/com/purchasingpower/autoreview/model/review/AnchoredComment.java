package com.purchasingpower.autoreview.model.review;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.purchasingpower.autoreview.model.diff.Side;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Inline comment ready to hand to a hosting provider: either path + position,
 * or path + line + side (+ start line for multi-line comments).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnchoredComment {

    private String path;
    private int position;
    private int line;
    private Side side;

    /**
     * Only set when the suggestion spans several commentable lines on the same side.
     */
    private Integer startLine;

    private String body;
    private SuggestionCategory category;
    private AnchorProvenance provenance;
}
