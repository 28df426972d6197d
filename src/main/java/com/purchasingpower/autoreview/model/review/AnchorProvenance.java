package com.purchasingpower.autoreview.model.review;

/**
 * How an anchor was derived, from most to least confident.
 *
 * @since 1.0.0
 */
public enum AnchorProvenance {
    EXACT_MATCH,        // line is commentable and existing code matches its content
    LINE_NUMBER_MATCH,  // line is commentable, content not verified
    CONTENT_CORRECTED,  // moved to the block found by fuzzy content search
    ADJUSTED,           // nearest commentable line, or same line on the other side
    UNRESOLVED;         // dropped

    public boolean isCorrection() {
        return this == CONTENT_CORRECTED || this == ADJUSTED;
    }
}
