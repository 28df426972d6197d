package com.purchasingpower.autoreview.model.diff;

/**
 * Classification of a single hunk line.
 *
 * @since 1.0.0
 */
public enum DiffLineType {
    ADDED('+'),
    REMOVED('-'),
    CONTEXT(' ');

    private final char marker;

    DiffLineType(char marker) {
        this.marker = marker;
    }

    public char getMarker() {
        return marker;
    }

    /**
     * Only added and removed lines may carry an inline review comment.
     */
    public boolean isCommentable() {
        return this != CONTEXT;
    }
}
