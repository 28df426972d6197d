package com.purchasingpower.autoreview.model.diff;

/**
 * Inclusive source/target line span covered by one hunk, kept for diagnostics.
 * For a side with zero length the end equals the start.
 */
public record HunkRange(
        int sourceStart,
        int sourceEnd,
        int targetStart,
        int targetEnd
) {
    @Override
    public String toString() {
        return "-" + sourceStart + ".." + sourceEnd + " +" + targetStart + ".." + targetEnd;
    }
}
