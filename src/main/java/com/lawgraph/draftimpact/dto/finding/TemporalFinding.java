package com.lawgraph.draftimpact.dto.finding;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class TemporalFinding implements Finding {

    TemporalIssueType type;
    Severity severity;
    String description;

    @JsonProperty("effective_date")
    LocalDate effectiveDate;

    @JsonProperty("affected_period")
    String affectedPeriod;

    @Singular
    List<String> provisions;

    @Override
    public int typeRank() {
        return type == null ? Integer.MAX_VALUE : type.ordinal();
    }

    public String typeLabel() {
        return TemporalIssueType.labelForRank(typeRank());
    }

    @Override
    public String nodeId() {
        return provisions.isEmpty() ? "" : provisions.get(0);
    }
}
