package com.lawgraph.draftimpact.dto.impact;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A provision reached from a changed node. Depth 1 means it references the change directly.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AffectedProvision {
    private String uri;
    private String label;

    @JsonProperty("document_id")
    private String documentId;

    private int depth;

    // e.g. "references repealed US-USC-TITLE-15:Art6502"
    private String reason;
}
