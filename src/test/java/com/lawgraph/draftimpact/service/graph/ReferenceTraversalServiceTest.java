package com.lawgraph.draftimpact.service.graph;

import com.lawgraph.draftimpact.dto.graph.TraversalDirection;
import com.lawgraph.draftimpact.dto.graph.TraversalNode;
import com.lawgraph.draftimpact.dto.graph.TraversalResult;
import com.lawgraph.draftimpact.model.graph.GraphVocabulary;
import com.lawgraph.draftimpact.model.graph.InMemoryTripleStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.lawgraph.draftimpact.GraphFixtures.addArticle;
import static com.lawgraph.draftimpact.GraphFixtures.addReference;
import static com.lawgraph.draftimpact.GraphFixtures.article;
import static org.assertj.core.api.Assertions.assertThat;

class ReferenceTraversalServiceTest {

    private final ReferenceTraversalService traversalService = new ReferenceTraversalService();
    private InMemoryTripleStore store;

    @BeforeEach
    void setUp() {
        // 6503 -> 6502 <- 6504, 6505 -> 6503, 6502 -> 6501
        store = new InMemoryTripleStore();
        for (String section : new String[] {"6501", "6502", "6503", "6504", "6505"}) {
            addArticle(store, section, "Section " + section);
        }
        addReference(store, "6503", "6502");
        store.add(article("6502"), GraphVocabulary.REFERENCED_BY, article("6504"));
        addReference(store, "6505", "6503");
        addReference(store, "6502", "6501");
        store.add(article("6502"), GraphVocabulary.TITLE, "Regulation of unfair practices");
    }

    @Test
    void traverse_collectsIncomingThroughForwardAndInverseEdges() {
        TraversalResult result = traversalService.traverse(store, article("6502"), 1, TraversalDirection.INCOMING);

        assertThat(result.getDirectIncoming()).extracting(TraversalNode::getUri)
                .containsExactly(article("6503"), article("6504"));
        assertThat(result.getDirectOutgoing()).isEmpty();
        assertThat(result.getTransitive()).isEmpty();
        assertThat(result.getTargetLabel()).isEqualTo("Regulation of unfair practices");
    }

    @Test
    void traverse_reachesSecondLevelOnlyWhenDepthAllows() {
        TraversalResult shallow = traversalService.traverse(store, article("6502"), 1, TraversalDirection.BOTH);
        TraversalResult deep = traversalService.traverse(store, article("6502"), 2, TraversalDirection.BOTH);

        assertThat(shallow.getTransitive()).isEmpty();
        assertThat(deep.getTransitive()).extracting(TraversalNode::getUri).containsExactly(article("6505"));
        assertThat(deep.getTransitive().get(0).getDepth()).isEqualTo(2);
        assertThat(deep.maxDepthReached()).isEqualTo(2);
    }

    @Test
    void traverse_neverRevisitsTheTarget() {
        addReference(store, "6501", "6502");

        TraversalResult result = traversalService.traverse(store, article("6502"), 3, TraversalDirection.BOTH);

        assertThat(result.getTransitive()).extracting(TraversalNode::getUri).doesNotContain(article("6502"));
        // 6501 is both referencing and referenced; it is reported once, as incoming
        assertThat(result.getDirectIncoming()).extracting(TraversalNode::getUri).contains(article("6501"));
        assertThat(result.getDirectOutgoing()).isEmpty();
        assertThat(result.getDirectIncoming()).extracting(TraversalNode::getNodeType).containsOnly("Article");
    }
}
