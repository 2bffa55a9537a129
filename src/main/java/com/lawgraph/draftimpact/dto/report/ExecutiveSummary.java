package com.lawgraph.draftimpact.dto.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutiveSummary {

    @JsonProperty("bill_title")
    private String billTitle;

    @JsonProperty("bill_number")
    private String billNumber;

    @JsonProperty("amendment_count")
    private int amendmentCount;

    @JsonProperty("titles_affected")
    @Builder.Default
    private List<Integer> titlesAffected = new ArrayList<>();

    @JsonProperty("provisions_modified")
    private int provisionsModified;

    @JsonProperty("provisions_repealed")
    private int provisionsRepealed;

    @JsonProperty("provisions_added")
    private int provisionsAdded;

    @JsonProperty("total_provisions_affected")
    private int totalProvisionsAffected;

    @JsonProperty("broken_cross_refs")
    private int brokenCrossRefs;

    @JsonProperty("conflict_errors")
    private int conflictErrors;

    @JsonProperty("conflict_warnings")
    private int conflictWarnings;

    @JsonProperty("obligations_added")
    private int obligationsAdded;

    @JsonProperty("obligations_removed")
    private int obligationsRemoved;

    @JsonProperty("rights_added")
    private int rightsAdded;

    @JsonProperty("rights_removed")
    private int rightsRemoved;

    @JsonProperty("risk_level")
    private RiskLevel riskLevel;

    @JsonProperty("risk_justification")
    private String riskJustification;
}
