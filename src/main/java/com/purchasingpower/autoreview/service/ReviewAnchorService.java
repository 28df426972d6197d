package com.purchasingpower.autoreview.service;

import com.purchasingpower.autoreview.model.review.AnchoringResult;
import com.purchasingpower.autoreview.model.review.ExistingComment;
import com.purchasingpower.autoreview.model.review.ReviewContext;
import com.purchasingpower.autoreview.model.review.Suggestion;

import java.util.List;

/**
 * Turns the model's suggestions for one pull request into inline comments that a hosting
 * provider will accept.
 */
public interface ReviewAnchorService {

    /**
     * Parses the diff, drops non-actionable and already-posted suggestions, and anchors the
     * rest. A suggestion that cannot be anchored is dropped on its own; the batch never fails
     * because of one suggestion.
     *
     * @param strict when true, suggestions are never moved to a nearby line
     */
    AnchoringResult anchor(String diff, List<Suggestion> suggestions, List<ExistingComment> existingComments,
                           boolean strict);

    /**
     * Same as {@link #anchor(String, List, List, boolean)} with the configured strictness.
     */
    AnchoringResult anchor(String diff, List<Suggestion> suggestions, List<ExistingComment> existingComments);

    /**
     * Markdown line mapping report of the diff.
     */
    String mappingReport(String diff);

    /**
     * Review prompt with the diff in decoupled layout.
     */
    String reviewPrompt(String diff, ReviewContext context);
}
