package com.lawgraph.draftimpact.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Nodes reached by a depth-limited reference traversal from one target.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TraversalResult {

    private String targetUri;
    private String targetLabel;
    private int maxDepth;

    @Builder.Default
    private List<TraversalNode> directIncoming = new ArrayList<>();

    @Builder.Default
    private List<TraversalNode> directOutgoing = new ArrayList<>();

    @Builder.Default
    private List<TraversalNode> transitive = new ArrayList<>();

    public int maxDepthReached() {
        int deepest = directIncoming.isEmpty() && directOutgoing.isEmpty() ? 0 : 1;
        for (TraversalNode node : transitive) {
            deepest = Math.max(deepest, node.getDepth());
        }
        return deepest;
    }
}
