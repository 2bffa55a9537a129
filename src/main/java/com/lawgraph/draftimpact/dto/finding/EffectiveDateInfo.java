package com.lawgraph.draftimpact.dto.finding;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Effective date language found in bill text.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_DEFAULT)
public class EffectiveDateInfo {

    LocalDate date;

    @JsonProperty("is_date_of_enactment")
    boolean dateOfEnactment;

    @JsonProperty("days_after_enactment")
    int daysAfterEnactment;

    @JsonProperty("raw_text")
    String rawText;
}
