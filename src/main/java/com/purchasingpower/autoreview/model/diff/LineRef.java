package com.purchasingpower.autoreview.model.diff;

/**
 * A line number on one side of a diff, the key review APIs use for line-based anchoring.
 */
public record LineRef(
        int line,
        Side side
) {
    public static LineRef right(int line) {
        return new LineRef(line, Side.RIGHT);
    }

    public static LineRef left(int line) {
        return new LineRef(line, Side.LEFT);
    }

    @Override
    public String toString() {
        return line + " (" + side + ")";
    }
}
