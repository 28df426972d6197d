package com.purchasingpower.autoreview.model.review;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Pull request metadata shown to the model next to the diff.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReviewContext {
    private String title;
    private String description;
}
