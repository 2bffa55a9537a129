package com.lawgraph.draftimpact.dto.diff;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiffSummary {
    private int totalAmendments;
    private int added;
    private int removed;
    private int modified;
    private int redesignated;
    private int unresolved;
    private int triplesInvalidated;
}
