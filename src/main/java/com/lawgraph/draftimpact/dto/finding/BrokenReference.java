package com.lawgraph.draftimpact.dto.finding;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * A cross-reference whose target is repealed, redesignated or modified by the bill.
 */
@Value
@Builder
public class BrokenReference implements Finding {

    @JsonProperty("source_uri")
    String sourceUri;

    @JsonProperty("source_label")
    String sourceLabel;

    @JsonProperty("source_document_id")
    String sourceDocumentId;

    @JsonProperty("target_uri")
    String targetUri;

    @JsonProperty("target_label")
    String targetLabel;

    Severity severity;

    String predicate;

    String reason;

    @Override
    public String getDescription() {
        return reason;
    }

    // Broken references form a single type
    @Override
    public int typeRank() {
        return 0;
    }

    @Override
    public String nodeId() {
        return sourceUri;
    }
}
