package com.lawgraph.draftimpact.dto.draft;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BillStatistics {
    @JsonProperty("section_count")
    private int sectionCount;

    @JsonProperty("amendment_count")
    private int amendmentCount;

    @JsonProperty("total_characters")
    private int totalCharacters;
}
