package com.purchasingpower.autoreview.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the {@code @ConfigurationProperties} classes of the review pipeline.
 *
 * <ul>
 *   <li>{@link DiffParsingConfig} - position numbering of the diff parser
 *   <li>{@link LineMappingConfig} - thresholds and defaults of the line mapper
 *   <li>{@link SuggestionFilterConfig} - suggestion filter policy
 * </ul>
 *
 * @since 1.0.0
 */
@Configuration
@EnableConfigurationProperties({
    DiffParsingConfig.class,
    LineMappingConfig.class,
    SuggestionFilterConfig.class
})
public class ConfigurationPropertiesEnablerConfig {
}
