package com.lawgraph.draftimpact.dto.draft;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A numbered section of a draft bill with the amendments recognized in it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DraftSection {
    private String number;
    private String title;

    @Builder.Default
    private List<Amendment> amendments = new ArrayList<>();

    @JsonProperty("raw_text")
    private String rawText;
}
