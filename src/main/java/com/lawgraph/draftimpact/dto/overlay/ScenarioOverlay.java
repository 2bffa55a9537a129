package com.lawgraph.draftimpact.dto.overlay;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.lawgraph.draftimpact.dto.draft.Amendment;
import com.lawgraph.draftimpact.model.graph.TripleStore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * "Proposed law" view: the touched document graphs with the bill applied, merged into one store.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScenarioOverlay {

    @JsonIgnore
    private TripleStore overlayStore;

    @Builder.Default
    private List<Amendment> appliedAmendments = new ArrayList<>();

    @Builder.Default
    private List<SkippedAmendment> skippedAmendments = new ArrayList<>();

    @Builder.Default
    private OverlayStats stats = new OverlayStats();
}
