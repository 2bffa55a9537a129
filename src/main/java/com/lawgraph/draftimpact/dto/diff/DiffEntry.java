package com.lawgraph.draftimpact.dto.diff;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.lawgraph.draftimpact.dto.draft.Amendment;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A resolved amendment: the graph node it targets and a snapshot of what currently hangs off it.
 */
@Value
@Builder(toBuilder = true)
public class DiffEntry {

    Amendment amendment;

    @JsonProperty("target_uri")
    String targetUri;

    @JsonProperty("target_document_id")
    String targetDocumentId;

    @JsonProperty("existing_text")
    @Builder.Default
    String existingText = "";

    @JsonProperty("proposed_text")
    @Builder.Default
    String proposedText = "";

    // Facts with the target as subject plus facts with it as object
    @JsonProperty("affected_triples")
    int affectedTriples;

    // Provisions that reference the target
    @JsonProperty("cross_refs_to")
    @Singular("crossRefTo")
    List<String> crossRefsTo;

    // Provisions the target references
    @JsonProperty("cross_refs_from")
    @Singular("crossRefFrom")
    List<String> crossRefsFrom;

    /**
     * Proposed text if set, otherwise the amendment's insert text.
     */
    public String effectiveProposedText() {
        if (proposedText != null && !proposedText.isEmpty()) {
            return proposedText;
        }
        return amendment == null ? "" : amendment.getInsertText();
    }
}
