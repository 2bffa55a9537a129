package com.lawgraph.draftimpact.dto.impact;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.lawgraph.draftimpact.dto.diff.DraftDiff;
import com.lawgraph.draftimpact.dto.finding.BrokenReference;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Transitive impact of a bill. A provision appears at most once across
 * {@link #directlyAffected} and {@link #transitivelyAffected}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DraftImpactResult {

    private static final Comparator<AffectedProvision> BY_DEPTH = Comparator
            .comparingInt(AffectedProvision::getDepth)
            .thenComparing(AffectedProvision::getUri);

    @JsonIgnore
    private DraftDiff diff;

    @JsonProperty("directly_affected")
    @Builder.Default
    private List<AffectedProvision> directlyAffected = new ArrayList<>();

    @JsonProperty("transitively_affected")
    @Builder.Default
    private List<AffectedProvision> transitivelyAffected = new ArrayList<>();

    @JsonProperty("broken_cross_refs")
    @Builder.Default
    private List<BrokenReference> brokenCrossRefs = new ArrayList<>();

    @JsonProperty("obligation_changes")
    @Builder.Default
    private ProvisionDelta obligationChanges = new ProvisionDelta();

    @JsonProperty("rights_changes")
    @Builder.Default
    private ProvisionDelta rightsChanges = new ProvisionDelta();

    @JsonProperty("total_provisions_affected")
    private int totalProvisionsAffected;

    @JsonProperty("max_depth_reached")
    private int maxDepthReached;

    public void sortByDepth() {
        directlyAffected.sort(BY_DEPTH);
        transitivelyAffected.sort(BY_DEPTH);
    }
}
