package com.purchasingpower.autoreview.model.review;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A review comment the bot already posted on the pull request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExistingComment {

    private String path;
    private Integer line;

    @JsonAlias("start_line")
    private Integer startLine;

    private String body;
}
