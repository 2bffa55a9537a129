package com.lawgraph.draftimpact.dto.finding;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.lawgraph.draftimpact.dto.draft.DraftBill;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConflictReport {

    @JsonIgnore
    private DraftBill bill;

    @Builder.Default
    private List<Conflict> conflicts = new ArrayList<>();

    @Builder.Default
    private ConflictSummary summary = new ConflictSummary();
}
