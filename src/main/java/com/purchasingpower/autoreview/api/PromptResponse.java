package com.purchasingpower.autoreview.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Review prompt response.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PromptResponse {

    private boolean success;
    private String error;
    private String prompt;

    public static PromptResponse success(String prompt) {
        return PromptResponse.builder()
            .success(true)
            .prompt(prompt)
            .build();
    }

    public static PromptResponse error(String error) {
        return PromptResponse.builder()
            .success(false)
            .error(error)
            .build();
    }
}
