package com.purchasingpower.autoreview.model.prompt;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Prompt template loaded from {@code classpath:prompts/*.yaml}.
 *
 * YAML structure:
 * <pre>
 * name: code-review
 * version: 1.0
 * model: default
 * temperature: 0.2
 * systemPrompt: |
 *   You are a senior reviewer...
 * userPrompt: |
 *   {{{diff}}}
 * </pre>
 *
 * @see com.purchasingpower.autoreview.service.PromptLibraryService
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PromptTemplate {
    private String name;
    private String version;
    private String model;
    private double temperature;
    private String systemPrompt;
    private String userPrompt;
}
