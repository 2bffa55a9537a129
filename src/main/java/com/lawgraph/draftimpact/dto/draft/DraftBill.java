package com.lawgraph.draftimpact.dto.draft;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A parsed draft bill: header metadata, numbered sections and the full raw text.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DraftBill {
    private String filename;
    private String title;

    @JsonProperty("short_title")
    private String shortTitle;

    @JsonProperty("bill_number")
    private String billNumber;

    private String congress;
    private String session;

    @Builder.Default
    private List<DraftSection> sections = new ArrayList<>();

    @JsonProperty("raw_text")
    private String rawText;

    @JsonIgnore
    public BillStatistics getStatistics() {
        int amendmentCount = sections.stream()
                .mapToInt(section -> section.getAmendments() == null ? 0 : section.getAmendments().size())
                .sum();
        return BillStatistics.builder()
                .sectionCount(sections.size())
                .amendmentCount(amendmentCount)
                .totalCharacters(rawText == null ? 0 : rawText.length())
                .build();
    }

    public String toDisplayString() {
        String displayTitle = shortTitle == null || shortTitle.isEmpty() ? title : shortTitle;
        StringBuilder result = new StringBuilder()
                .append(billNumber)
                .append(" — ")
                .append(displayTitle);
        if (congress != null && !congress.isEmpty()) {
            result.append(" (").append(congress).append(" Congress)");
        }
        return result.toString();
    }
}
