package com.purchasingpower.autoreview.config;

import com.purchasingpower.autoreview.model.diff.Side;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Tuning for resolving model suggestions onto diff positions.
 *
 * <p>Properties are loaded from the {@code app.review.line-mapping} namespace in application.yml.
 * Example configuration:
 * <pre>
 * app:
 *   review:
 *     line-mapping:
 *       similarity-threshold: 0.6
 *       nearest-line-radius: 5
 *       default-side: RIGHT
 *       strict: false
 * </pre>
 *
 * <p><b>Thread Safety:</b> bound once at startup and read-only afterwards.
 *
 * @since 1.0.0
 */
@ConfigurationProperties(prefix = "app.review.line-mapping")
@Validated
@Data
public class LineMappingConfig {

    /**
     * Minimum similarity (0..1) a window of diff lines must reach to move an anchor
     * during content correction.
     * Default: 0.6
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double similarityThreshold = 0.6;

    /**
     * How many lines above and below the claimed line the nearest-line fallback inspects.
     * Default: 5
     */
    @Min(0)
    @Max(50)
    private int nearestLineRadius = 5;

    /**
     * Side used when a suggestion does not state one.
     * Default: RIGHT
     */
    @NotNull
    private Side defaultSide = Side.RIGHT;

    /**
     * Default strictness for callers that do not choose one. Strict resolution never
     * applies the nearest-line fallback.
     * Default: false
     */
    private boolean strict = false;
}
