package com.lawgraph.draftimpact.repository;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Catalog entry for one ingested regulation document.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentEntry {
    private String documentId;     // e.g. "us-usc-title-15"
    private String name;
    private String jurisdiction;
    private int tripleCount;
}
