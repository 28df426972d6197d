package com.purchasingpower.autoreview.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Diff parser settings, bound from {@code app.review.diff}.
 * <pre>
 * app:
 *   review:
 *     diff:
 *       count-hunk-headers: false
 * </pre>
 *
 * @since 1.0.0
 */
@ConfigurationProperties(prefix = "app.review.diff")
@Data
public class DiffParsingConfig {

    /**
     * When true, every hunk header after the first one of a file also takes a diff position,
     * matching the legacy GitHub {@code position} numbering. Off by default: positions count
     * hunk lines only.
     */
    private boolean countHunkHeaders = false;
}
