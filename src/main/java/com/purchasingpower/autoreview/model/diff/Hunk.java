package com.purchasingpower.autoreview.model.diff;

import lombok.Builder;
import lombok.Value;

/**
 * One contiguous change region of a file diff, as declared by its {@code @@} header.
 */
@Value
@Builder
public class Hunk {

    int sourceStart;
    int sourceLength;
    int targetStart;
    int targetLength;

    /**
     * Text after the closing {@code @@}, usually the enclosing function signature. Never null.
     */
    @Builder.Default
    String section = "";

    public String header() {
        String header = "@@ -" + sourceStart + "," + sourceLength
                + " +" + targetStart + "," + targetLength + " @@";
        return section.isEmpty() ? header : header + " " + section;
    }

    public HunkRange toRange() {
        return new HunkRange(
                sourceStart,
                sourceLength == 0 ? sourceStart : sourceStart + sourceLength - 1,
                targetStart,
                targetLength == 0 ? targetStart : targetStart + targetLength - 1
        );
    }
}
