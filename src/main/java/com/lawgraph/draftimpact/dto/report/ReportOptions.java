package com.lawgraph.draftimpact.dto.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Which analysis stages to run when building a report.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportOptions {

    @Builder.Default
    private boolean includeDiff = true;

    @Builder.Default
    private boolean includeImpact = true;

    // Values below 1 fall back to the configured default depth
    @Builder.Default
    private int impactDepth = 3;

    @Builder.Default
    private boolean includeConflicts = true;

    @Builder.Default
    private boolean includeTemporal = true;

    @Builder.Default
    private boolean includeOverlay = false;

    public static ReportOptions defaults() {
        return ReportOptions.builder().build();
    }
}
