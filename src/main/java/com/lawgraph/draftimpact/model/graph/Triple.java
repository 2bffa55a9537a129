package com.lawgraph.draftimpact.model.graph;

import lombok.Value;

/**
 * A single (subject, predicate, object) fact in the regulation graph.
 */
@Value
public class Triple {
    String subject;
    String predicate;
    String object;

    public static Triple of(String subject, String predicate, String object) {
        return new Triple(subject, predicate, object);
    }
}
