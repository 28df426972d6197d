package com.purchasingpower.autoreview.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Rules for discarding non-actionable suggestions before anchoring.
 *
 * <p>Properties are loaded from the {@code app.review.filter} namespace:
 * <pre>
 * app:
 *   review:
 *     filter:
 *       missing-existing-code: DROP
 *       identical-code-threshold: 0.95
 *       duplicate-detection: true
 * </pre>
 *
 * @since 1.0.0
 */
@ConfigurationProperties(prefix = "app.review.filter")
@Validated
@Data
public class SuggestionFilterConfig {

    /**
     * What to do with a suggestion that carries replacement code but no existing code.
     */
    @NotNull
    private MissingExistingCodePolicy missingExistingCode = MissingExistingCodePolicy.DROP;

    /**
     * Replacement code scoring above this ratio against the existing code counts as unchanged.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double identicalCodeThreshold = 0.95;

    /**
     * Skip suggestions the bot already posted on the pull request.
     */
    private boolean duplicateDetection = true;

    public enum MissingExistingCodePolicy {
        DROP,   // remove the suggestion
        WARN,   // keep it, log a warning
        KEEP    // keep it silently
    }
}
