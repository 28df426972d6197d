package com.purchasingpower.autoreview.model.review;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Category tag the model attaches to a suggestion.
 *
 * @since 1.0.0
 */
public enum SuggestionCategory {
    BUG,
    SECURITY,
    PERFORMANCE,
    REFACTOR,
    IMPROVEMENT,
    STYLE,
    DOCUMENTATION,
    OTHER;

    /**
     * Lenient lookup: models answer "bug", "Bug" or invent new tags.
     */
    @JsonCreator
    public static SuggestionCategory fromValue(String value) {
        if (value == null || value.isBlank()) {
            return OTHER;
        }
        for (SuggestionCategory category : values()) {
            if (category.name().equalsIgnoreCase(value.trim())) {
                return category;
            }
        }
        return OTHER;
    }

    public boolean isCritical() {
        return this == BUG || this == SECURITY;
    }
}
