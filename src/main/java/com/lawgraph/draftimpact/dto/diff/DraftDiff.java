package com.lawgraph.draftimpact.dto.diff;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.lawgraph.draftimpact.dto.draft.DraftBill;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Classified changes a bill makes to the regulation graph.
 * A resolvable amendment lands in exactly one bucket; the rest are described in
 * {@link #unresolvedTargets}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DraftDiff {

    @JsonIgnore
    private DraftBill bill;

    @Builder.Default
    private List<DiffEntry> added = new ArrayList<>();

    @Builder.Default
    private List<DiffEntry> removed = new ArrayList<>();

    @Builder.Default
    private List<DiffEntry> modified = new ArrayList<>();

    @Builder.Default
    private List<DiffEntry> redesignated = new ArrayList<>();

    @JsonProperty("unresolved_targets")
    @Builder.Default
    private List<String> unresolvedTargets = new ArrayList<>();

    @JsonProperty("triples_invalidated")
    private int triplesInvalidated;

    public DiffSummary getSummary() {
        int resolved = added.size() + removed.size() + modified.size() + redesignated.size();
        return DiffSummary.builder()
                .totalAmendments(resolved + unresolvedTargets.size())
                .added(added.size())
                .removed(removed.size())
                .modified(modified.size())
                .redesignated(redesignated.size())
                .unresolved(unresolvedTargets.size())
                .triplesInvalidated(triplesInvalidated)
                .build();
    }

    @JsonIgnore
    public List<DiffEntry> allEntries() {
        List<DiffEntry> all = new ArrayList<>();
        all.addAll(added);
        all.addAll(removed);
        all.addAll(modified);
        all.addAll(redesignated);
        return all;
    }
}
