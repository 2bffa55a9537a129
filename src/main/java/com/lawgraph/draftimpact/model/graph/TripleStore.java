package com.lawgraph.draftimpact.model.graph;

import java.util.Collection;
import java.util.List;

/**
 * Pattern-matching fact store. A {@code null} or empty component in
 * {@link #find} and {@link #delete} acts as a wildcard.
 */
public interface TripleStore {

    List<Triple> find(String subject, String predicate, String object);

    /**
     * Adds a fact. Adding a fact that already exists is a no-op.
     *
     * @throws IllegalArgumentException if any component is blank
     */
    void add(String subject, String predicate, String object);

    /**
     * @return number of facts removed
     */
    int delete(String subject, String predicate, String object);

    void bulkAdd(Collection<Triple> triples);

    void mergeFrom(TripleStore other);

    int count();

    List<Triple> all();

    /**
     * @return the object of the first fact matching (subject, predicate, *), or an empty string
     */
    String getOne(String subject, String predicate);
}
