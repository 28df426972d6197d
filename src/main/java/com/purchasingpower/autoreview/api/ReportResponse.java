package com.purchasingpower.autoreview.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Line mapping report response.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportResponse {

    private boolean success;
    private String error;
    private String report;

    public static ReportResponse success(String report) {
        return ReportResponse.builder()
            .success(true)
            .report(report)
            .build();
    }

    public static ReportResponse error(String error) {
        return ReportResponse.builder()
            .success(false)
            .error(error)
            .build();
    }
}
