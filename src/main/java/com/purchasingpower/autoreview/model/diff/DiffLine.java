package com.purchasingpower.autoreview.model.diff;

import lombok.Builder;
import lombok.Value;

/**
 * A single line inside a hunk.
 * ADDED lines only have a target number, REMOVED lines only a source number,
 * CONTEXT lines have both.
 */
@Value
@Builder
public class DiffLine {

    DiffLineType type;

    Integer sourceLineNo;

    Integer targetLineNo;

    /**
     * Line text without the leading diff marker.
     */
    String content;

    /**
     * Diff position of this line within its file (1-based).
     */
    int position;

    int hunkIndex;

    public String getRawText() {
        return type.getMarker() + content;
    }

    public boolean isCommentable() {
        return type.isCommentable();
    }

    /**
     * The key this line is anchored by: target line for added and context lines,
     * source line for removed lines.
     */
    public LineRef getAnchorRef() {
        return type == DiffLineType.REMOVED
                ? LineRef.left(sourceLineNo)
                : LineRef.right(targetLineNo);
    }
}
