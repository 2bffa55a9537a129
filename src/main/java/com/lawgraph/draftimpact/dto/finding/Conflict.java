package com.lawgraph.draftimpact.dto.finding;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.lawgraph.draftimpact.dto.draft.Amendment;
import lombok.Builder;
import lombok.Value;

/**
 * A semantic conflict between a proposed amendment and existing law.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class Conflict implements Finding {

    ConflictType type;
    Severity severity;

    @JsonProperty("source_amendment")
    Amendment sourceAmendment;

    // Obligation or right node implicated by the conflict
    @JsonProperty("existing_provision")
    @Builder.Default
    String existingProvision = "";

    @JsonProperty("existing_text")
    @Builder.Default
    String existingText = "";

    @JsonProperty("proposed_text")
    @Builder.Default
    String proposedText = "";

    String description;

    @Override
    public int typeRank() {
        return type == null ? Integer.MAX_VALUE : type.ordinal();
    }

    public String typeLabel() {
        return ConflictType.labelForRank(typeRank());
    }

    @Override
    public String nodeId() {
        return existingProvision;
    }
}
