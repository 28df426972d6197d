package com.purchasingpower.autoreview.model.review;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.purchasingpower.autoreview.model.diff.Side;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One review suggestion as produced by the language model.
 *
 * <p>Line numbers are the model's claim and are frequently wrong; they are only a hint for
 * {@link com.purchasingpower.autoreview.service.mapping.LineMapper}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Suggestion {

    @JsonAlias({"file_name", "file", "path"})
    private String fileName;

    @JsonAlias("start_line")
    private Integer startLine;

    @JsonAlias({"end_line", "line"})
    private Integer endLine;

    /**
     * Null means "not stated"; the configured default side applies.
     */
    private Side side;

    private String comment;

    private SuggestionCategory category;

    @JsonAlias("suggested_code")
    private String suggestedCode;

    /**
     * Code the replacement is meant to replace. Optional.
     */
    @JsonAlias("existing_code")
    private String existingCode;

    public boolean hasExistingCode() {
        return existingCode != null && !existingCode.isBlank();
    }

    public String describe() {
        return fileName + ":" + startLine + "-" + endLine + " (" + (side != null ? side : "default side") + ")";
    }
}
