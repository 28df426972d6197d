package com.purchasingpower.autoreview.api;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.purchasingpower.autoreview.model.review.ExistingComment;
import com.purchasingpower.autoreview.model.review.Suggestion;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Anchoring request: the pull request diff plus the model's suggestions.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AnchorRequest {

    private String diff;

    @Builder.Default
    private List<Suggestion> suggestions = new ArrayList<>();

    /**
     * Bot comments already on the pull request, for duplicate detection.
     */
    @Builder.Default
    @JsonAlias("existing_comments")
    private List<ExistingComment> existingComments = new ArrayList<>();

    /**
     * Null uses {@code app.review.line-mapping.strict}.
     */
    private Boolean strict;
}
