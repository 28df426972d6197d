package com.purchasingpower.autoreview.service;

import com.purchasingpower.autoreview.config.SuggestionFilterConfig;
import com.purchasingpower.autoreview.config.SuggestionFilterConfig.MissingExistingCodePolicy;
import com.purchasingpower.autoreview.model.review.Suggestion;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Suggestion Filter Service Tests")
class SuggestionFilterServiceTest {

    private SuggestionFilterConfig config;
    private SuggestionFilterService filter;

    @BeforeEach
    void setUp() {
        config = new SuggestionFilterConfig();
        filter = new SuggestionFilterService(config);
    }

    private static Suggestion.SuggestionBuilder actionable() {
        return Suggestion.builder()
                .fileName("app.py")
                .startLine(3)
                .endLine(3)
                .comment("Add a null check before dereferencing user")
                .existingCode("name = user.name")
                .suggestedCode("name = user.name if user else None");
    }

    @Test
    @DisplayName("Actionable suggestion is kept")
    void keepsActionableSuggestion() {
        SuggestionFilterService.FilterOutcome outcome = filter.filter(List.of(actionable().build()));

        assertThat(outcome.getKept()).hasSize(1);
        assertThat(outcome.getRemoved()).isEmpty();
    }

    @Test
    @DisplayName("Empty comment and missing suggested code are removed")
    void emptyFields() {
        assertThat(filter.rejectionReason(actionable().comment(" ").build())).isEqualTo("empty comment");
        assertThat(filter.rejectionReason(actionable().suggestedCode(null).build())).isEqualTo("no suggested code");
    }

    @Test
    @DisplayName("Missing existing code follows the configured policy")
    void missingExistingCodePolicy() {
        Suggestion withoutExisting = actionable().existingCode(null).build();

        assertThat(filter.rejectionReason(withoutExisting)).isEqualTo("missing existing code");

        config.setMissingExistingCode(MissingExistingCodePolicy.WARN);
        assertThat(filter.rejectionReason(withoutExisting)).isNull();

        config.setMissingExistingCode(MissingExistingCodePolicy.KEEP);
        assertThat(filter.rejectionReason(withoutExisting)).isNull();
    }

    @Test
    @DisplayName("Replacement identical to the existing code is removed")
    void identicalCode() {
        Suggestion same = actionable()
                .existingCode("+name  =  user.name\n")
                .suggestedCode("name = user.name")
                .build();

        assertThat(filter.rejectionReason(same)).isEqualTo("suggested code identical to existing code");
        assertThat(filter.isCodeIdentical("total = a + b", "total = a + c")).isFalse();
    }

    @Test
    @DisplayName("Praise and pure observations are removed")
    void praiseAndObservations() {
        assertThat(filter.rejectionReason(actionable().comment("Great work, this looks good.").build()))
                .isEqualTo("positive-only comment without actionable feedback");
        assertThat(filter.rejectionReason(actionable().comment("This function computes the total of all items.").build()))
                .isEqualTo("informational comment without actionable feedback");
    }

    @Test
    @DisplayName("Praise combined with criticism is kept")
    void praiseWithCriticism() {
        assertThat(filter.rejectionReason(actionable()
                .comment("Nice refactor, but this loop should stop at the first match.").build()))
                .isNull();
    }

    @Test
    @DisplayName("Removed suggestions carry their reason")
    void removalReasons() {
        Suggestion praise = actionable().comment("LGTM").build();

        SuggestionFilterService.FilterOutcome outcome = filter.filter(List.of(actionable().build(), praise));

        assertThat(outcome.getKept()).hasSize(1);
        assertThat(outcome.getRemoved()).singleElement().satisfies(removal -> {
            assertThat(removal.getSuggestion()).isSameAs(praise);
            assertThat(removal.getReason()).startsWith("positive-only");
        });
    }
}
