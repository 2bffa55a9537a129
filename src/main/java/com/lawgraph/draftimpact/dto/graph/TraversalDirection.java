package com.lawgraph.draftimpact.dto.graph;

public enum TraversalDirection {
    INCOMING,
    OUTGOING,
    BOTH;

    public boolean includesIncoming() {
        return this == INCOMING || this == BOTH;
    }

    public boolean includesOutgoing() {
        return this == OUTGOING || this == BOTH;
    }
}
