package com.lawgraph.draftimpact.dto.finding;

import java.util.Comparator;

/**
 * Common shape of analysis findings.
 */
public interface Finding {

    /**
     * Error, then warning, then info; ties broken by type, then by implicated node id.
     */
    Comparator<Finding> ORDER = Comparator
            .comparing(Finding::getSeverity)
            .thenComparingInt(Finding::typeRank)
            .thenComparing(Finding::nodeId, Comparator.nullsFirst(Comparator.naturalOrder()));

    Severity getSeverity();

    String getDescription();

    int typeRank();

    String nodeId();

    default String severityLabel() {
        return Severity.labelForRank(getSeverity() == null ? -1 : getSeverity().ordinal());
    }
}
