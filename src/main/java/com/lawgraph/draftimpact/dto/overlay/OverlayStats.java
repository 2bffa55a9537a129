package com.lawgraph.draftimpact.dto.overlay;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OverlayStats {
    private int triplesRemoved;
    private int triplesAdded;
    private int baseTriples;       // facts in the cloned base snapshots
    private int overlayTriples;    // facts in the merged overlay
}
