package com.lawgraph.draftimpact.dto.finding;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConflictType {
    OBLIGATION_CONTRADICTION("obligation_contradiction"),
    OBLIGATION_DUPLICATE("obligation_duplicate"),
    OBLIGATION_ORPHANED("obligation_orphaned"),
    RIGHTS_NARROWING("rights_narrowing"),
    RIGHTS_CONTRADICTION("rights_contradiction"),
    RIGHTS_EXPANSION("rights_expansion");

    private final String label;

    ConflictType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static String labelForRank(int rank) {
        ConflictType[] values = values();
        if (rank >= 0 && rank < values.length) {
            return values[rank].label;
        }
        return "unknown";
    }
}
