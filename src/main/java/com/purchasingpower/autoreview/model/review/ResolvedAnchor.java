package com.purchasingpower.autoreview.model.review;

import com.purchasingpower.autoreview.model.diff.LineRef;
import com.purchasingpower.autoreview.model.diff.Side;
import lombok.Builder;
import lombok.Value;

/**
 * Concrete comment location for one suggestion.
 */
@Value
@Builder
public class ResolvedAnchor {

    String filePath;

    /**
     * Diff position within the file, for position-based review APIs.
     */
    int position;

    /**
     * Line number on {@link #side}, for line-based review APIs.
     */
    int line;

    Side side;

    AnchorProvenance provenance;

    /**
     * Line the suggestion originally claimed.
     */
    int originalLine;

    /**
     * Human readable explanation, e.g. {@code adjusted from 12 to 14}.
     */
    String detail;

    public LineRef toLineRef() {
        return new LineRef(line, side);
    }
}
