package com.lawgraph.draftimpact.model.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Hash-indexed in-memory {@link TripleStore}.
 *
 * Facts are kept in insertion order so that query results, and everything derived from
 * them, are stable across runs. Subject, predicate and object each have their own index;
 * a query scans the smallest candidate set among the bound components.
 */
public class InMemoryTripleStore implements TripleStore {

    private final Set<Triple> triples = new LinkedHashSet<>();
    private final Map<String, Set<Triple>> bySubject = new HashMap<>();
    private final Map<String, Set<Triple>> byPredicate = new HashMap<>();
    private final Map<String, Set<Triple>> byObject = new HashMap<>();

    public static InMemoryTripleStore copyOf(TripleStore source) {
        InMemoryTripleStore copy = new InMemoryTripleStore();
        copy.bulkAdd(source.all());
        return copy;
    }

    @Override
    public List<Triple> find(String subject, String predicate, String object) {
        Collection<Triple> candidates = triples;

        if (isBound(subject)) {
            candidates = smaller(candidates, bySubject.getOrDefault(subject, Collections.emptySet()));
        }
        if (isBound(predicate)) {
            candidates = smaller(candidates, byPredicate.getOrDefault(predicate, Collections.emptySet()));
        }
        if (isBound(object)) {
            candidates = smaller(candidates, byObject.getOrDefault(object, Collections.emptySet()));
        }
        if (candidates.isEmpty()) {
            return new ArrayList<>();
        }

        return candidates.stream()
                .filter(t -> matches(t, subject, predicate, object))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public void add(String subject, String predicate, String object) {
        if (!isBound(subject) || !isBound(predicate) || !isBound(object)) {
            throw new IllegalArgumentException(
                    "Triple components must not be blank: (" + subject + ", " + predicate + ", " + object + ")");
        }
        Triple triple = Triple.of(subject, predicate, object);
        if (!triples.add(triple)) {
            return;
        }
        bySubject.computeIfAbsent(subject, k -> new LinkedHashSet<>()).add(triple);
        byPredicate.computeIfAbsent(predicate, k -> new LinkedHashSet<>()).add(triple);
        byObject.computeIfAbsent(object, k -> new LinkedHashSet<>()).add(triple);
    }

    @Override
    public int delete(String subject, String predicate, String object) {
        List<Triple> matched = find(subject, predicate, object);
        for (Triple triple : matched) {
            triples.remove(triple);
            unindex(bySubject, triple.getSubject(), triple);
            unindex(byPredicate, triple.getPredicate(), triple);
            unindex(byObject, triple.getObject(), triple);
        }
        return matched.size();
    }

    @Override
    public void bulkAdd(Collection<Triple> toAdd) {
        for (Triple triple : toAdd) {
            add(triple.getSubject(), triple.getPredicate(), triple.getObject());
        }
    }

    @Override
    public void mergeFrom(TripleStore other) {
        bulkAdd(other.all());
    }

    @Override
    public int count() {
        return triples.size();
    }

    @Override
    public List<Triple> all() {
        return new ArrayList<>(triples);
    }

    @Override
    public String getOne(String subject, String predicate) {
        List<Triple> matched = find(subject, predicate, null);
        return matched.isEmpty() ? "" : matched.get(0).getObject();
    }

    private static boolean isBound(String component) {
        return component != null && !component.isEmpty();
    }

    private static boolean matches(Triple triple, String subject, String predicate, String object) {
        return (!isBound(subject) || subject.equals(triple.getSubject()))
                && (!isBound(predicate) || predicate.equals(triple.getPredicate()))
                && (!isBound(object) || object.equals(triple.getObject()));
    }

    private static Collection<Triple> smaller(Collection<Triple> current, Collection<Triple> candidate) {
        return candidate.size() < current.size() ? candidate : current;
    }

    private static void unindex(Map<String, Set<Triple>> index, String key, Triple triple) {
        Set<Triple> bucket = index.get(key);
        if (bucket == null) {
            return;
        }
        bucket.remove(triple);
        if (bucket.isEmpty()) {
            index.remove(key);
        }
    }
}
