package com.lawgraph.draftimpact.repository;

import com.lawgraph.draftimpact.exception.LibraryUnavailableException;
import com.lawgraph.draftimpact.model.graph.TripleStore;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Library holding document graphs in memory.
 */
@Slf4j
public class InMemoryDraftLibrary implements DraftLibrary {

    private final String baseUri;
    private final Map<String, DocumentEntry> documents = new LinkedHashMap<>();
    private final Map<String, TripleStore> graphs = new LinkedHashMap<>();

    public InMemoryDraftLibrary(String baseUri) {
        this.baseUri = baseUri == null ? "" : baseUri;
    }

    public InMemoryDraftLibrary register(String documentId, TripleStore graph) {
        documents.put(documentId, DocumentEntry.builder()
                .documentId(documentId)
                .name(documentId)
                .tripleCount(graph.count())
                .build());
        graphs.put(documentId, graph);
        log.debug("Registered document {} with {} triples", documentId, graph.count());
        return this;
    }

    @Override
    public TripleStore loadGraph(String documentId) {
        TripleStore graph = graphs.get(documentId);
        if (graph == null) {
            throw new LibraryUnavailableException("No graph stored for document " + documentId);
        }
        return graph;
    }

    @Override
    public Optional<DocumentEntry> getDocument(String documentId) {
        return Optional.ofNullable(documents.get(documentId));
    }

    @Override
    public String getBaseUri() {
        return baseUri;
    }
}
