package com.lawgraph.draftimpact.dto.finding;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Three-level finding severity. Declaration order is the sort order: errors first.
 */
public enum Severity {
    ERROR("error"),
    WARNING("warning"),
    INFO("info");

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Label for a numeric rank (0 = error). Out-of-range ranks render as "unknown".
     */
    public static String labelForRank(int rank) {
        Severity[] values = values();
        if (rank >= 0 && rank < values.length) {
            return values[rank].label;
        }
        return "unknown";
    }
}
