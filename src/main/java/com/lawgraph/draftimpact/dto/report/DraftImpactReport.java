package com.lawgraph.draftimpact.dto.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.lawgraph.draftimpact.dto.diff.DraftDiff;
import com.lawgraph.draftimpact.dto.draft.DraftBill;
import com.lawgraph.draftimpact.dto.finding.ConflictReport;
import com.lawgraph.draftimpact.dto.finding.TemporalFinding;
import com.lawgraph.draftimpact.dto.impact.DraftImpactResult;
import com.lawgraph.draftimpact.dto.overlay.ScenarioOverlay;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Everything known about a bill's effect on existing law, ready for rendering.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DraftImpactReport {

    private DraftBill bill;

    @JsonProperty("generated_at")
    private Instant generatedAt;

    @JsonProperty("risk_level")
    private RiskLevel riskLevel;

    @JsonProperty("executive_summary")
    private ExecutiveSummary executiveSummary;

    private DraftDiff diff;
    private DraftImpactResult impact;
    private ConflictReport conflicts;

    @JsonProperty("temporal_findings")
    private List<TemporalFinding> temporalFindings;

    private ScenarioOverlay overlay;

    // Stages that failed; the report carries whatever the other stages produced
    @Builder.Default
    private List<String> warnings = new ArrayList<>();
}
