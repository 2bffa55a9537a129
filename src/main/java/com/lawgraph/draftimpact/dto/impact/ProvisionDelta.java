package com.lawgraph.draftimpact.dto.impact;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Obligation or right nodes hanging off added, removed and modified provisions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProvisionDelta {

    @Builder.Default
    private List<String> added = new ArrayList<>();

    @Builder.Default
    private List<String> removed = new ArrayList<>();

    @Builder.Default
    private List<String> modified = new ArrayList<>();

    public int total() {
        return added.size() + removed.size() + modified.size();
    }
}
