package com.lawgraph.draftimpact.service.graph;

import com.lawgraph.draftimpact.model.graph.GraphVocabulary;
import com.lawgraph.draftimpact.model.graph.TripleStore;

/**
 * Display helpers for graph nodes.
 */
public final class ProvisionLabels {

    private ProvisionLabels() {
    }

    /**
     * Last segment of a URI after ':', '/' or '#'.
     */
    public static String uriLabel(String uri) {
        for (int i = uri.length() - 1; i >= 0; i--) {
            char c = uri.charAt(i);
            if (c == ':' || c == '/' || c == '#') {
                return uri.substring(i + 1);
            }
        }
        return uri;
    }

    /**
     * Title, then rdfs:label, then the URI's last segment.
     */
    public static String displayLabel(TripleStore store, String uri) {
        String title = store.getOne(uri, GraphVocabulary.TITLE);
        if (!title.isEmpty()) {
            return title;
        }
        String label = store.getOne(uri, GraphVocabulary.RDFS_LABEL);
        if (!label.isEmpty()) {
            return label;
        }
        return uriLabel(uri);
    }

    /**
     * Like {@link #displayLabel} but also consults defined terms.
     */
    public static String nodeLabel(TripleStore store, String uri) {
        String title = store.getOne(uri, GraphVocabulary.TITLE);
        if (!title.isEmpty()) {
            return title;
        }
        String label = store.getOne(uri, GraphVocabulary.RDFS_LABEL);
        if (!label.isEmpty()) {
            return label;
        }
        String term = store.getOne(uri, GraphVocabulary.TERM);
        if (!term.isEmpty()) {
            return term;
        }
        return uriLabel(uri);
    }

    /**
     * rdf:type if present, otherwise inferred from the URI shape.
     */
    public static String nodeType(TripleStore store, String uri) {
        String declared = store.getOne(uri, GraphVocabulary.RDF_TYPE);
        if (!declared.isEmpty()) {
            return uriLabel(declared);
        }
        if (uri.contains(":Right:")) {
            return "Right";
        }
        if (uri.contains(":Obligation:")) {
            return "Obligation";
        }
        if (uri.contains(":Art")) {
            return "Article";
        }
        if (uri.contains(":Chapter")) {
            return "Chapter";
        }
        if (uri.contains(":Section")) {
            return "Section";
        }
        if (uri.contains(":Term:")) {
            return "DefinedTerm";
        }
        return "Unknown";
    }
}
