package com.lawgraph.draftimpact.dto.draft;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * One amending directive recognized in bill text. Immutable once recognized.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class Amendment {

    AmendmentType type;

    @JsonProperty("target_title")
    @Builder.Default
    String targetTitle = "";

    @JsonProperty("target_section")
    @Builder.Default
    String targetSection = "";

    // Parenthesized path such as "(b)" or "(b)(2)"
    @JsonProperty("target_subsection")
    @Builder.Default
    String targetSubsection = "";

    @JsonProperty("strike_text")
    @Builder.Default
    String strikeText = "";

    @JsonProperty("insert_text")
    @Builder.Default
    String insertText = "";

    @Builder.Default
    String description = "";

    public boolean hasSubsection() {
        return targetSubsection != null && !targetSubsection.isEmpty();
    }
}
