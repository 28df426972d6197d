package com.purchasingpower.autoreview.model.diff;

/**
 * Which file of a diff a line number refers to.
 *
 * @since 1.0.0
 */
public enum Side {
    LEFT,   // old / source file numbering
    RIGHT;  // new / target file numbering

    public Side opposite() {
        return this == LEFT ? RIGHT : LEFT;
    }
}
