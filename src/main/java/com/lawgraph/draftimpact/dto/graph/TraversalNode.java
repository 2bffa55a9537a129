package com.lawgraph.draftimpact.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TraversalNode {
    private String uri;
    private String label;
    private String nodeType;    // Article, Right, Obligation, Unknown, ...
    private int depth;
    private TraversalDirection direction;
}
