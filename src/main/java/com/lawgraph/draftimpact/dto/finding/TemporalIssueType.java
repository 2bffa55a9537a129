package com.lawgraph.draftimpact.dto.finding;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TemporalIssueType {
    GAP("temporal_gap"),
    CONTRADICTION("temporal_contradiction"),
    RETROACTIVE("temporal_retroactive"),
    SUNSET("temporal_sunset");

    private final String label;

    TemporalIssueType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static String labelForRank(int rank) {
        TemporalIssueType[] values = values();
        if (rank >= 0 && rank < values.length) {
            return values[rank].label;
        }
        return "unknown";
    }
}
