package com.lawgraph.draftimpact.model.graph;

import java.util.List;

/**
 * Predicate and class names used by ingested regulation graphs.
 */
public final class GraphVocabulary {

    private GraphVocabulary() {
    }

    // Core
    public static final String RDF_TYPE = "rdf:type";
    public static final String RDFS_LABEL = "rdfs:label";

    // Classes
    public static final String CLASS_ARTICLE = "reg:Article";
    public static final String CLASS_OBLIGATION = "reg:Obligation";
    public static final String CLASS_RIGHT = "reg:Right";

    // Content
    public static final String TITLE = "reg:title";
    public static final String TEXT = "reg:text";
    public static final String NUMBER = "reg:number";
    public static final String TERM = "reg:term";

    // Hierarchy
    public static final String PART_OF = "reg:partOf";
    public static final String CONTAINS = "reg:contains";
    public static final String BELONGS_TO = "reg:belongsTo";
    public static final String HAS_ARTICLE = "reg:hasArticle";

    // Cross references
    public static final String REFERENCES = "reg:references";
    public static final String REFERENCED_BY = "reg:referencedBy";
    public static final String RESOLVED_TARGET = "reg:resolvedTarget";
    public static final String REFERS_TO_ARTICLE = "reg:refersToArticle";
    public static final String REFERS_TO_CHAPTER = "reg:refersToChapter";
    public static final String REFERS_TO_PARAGRAPH = "reg:refersToParagraph";
    public static final String REFERS_TO_POINT = "reg:refersToPoint";

    public static final List<String> TYPED_REFERENCE_PREDICATES = List.of(
            REFERS_TO_ARTICLE, REFERS_TO_CHAPTER, REFERS_TO_PARAGRAPH, REFERS_TO_POINT);

    // Semantics
    public static final String IMPOSES_OBLIGATION = "reg:imposesObligation";
    public static final String GRANTS_RIGHT = "reg:grantsRight";
    public static final String OBLIGATION_TYPE = "reg:obligationType";
    public static final String RIGHT_TYPE = "reg:rightType";

    // Temporal
    public static final String TEMPORAL_KIND = "reg:temporalKind";
}
