package com.lawgraph.draftimpact.service.graph;

import com.lawgraph.draftimpact.dto.graph.TraversalDirection;
import com.lawgraph.draftimpact.dto.graph.TraversalNode;
import com.lawgraph.draftimpact.dto.graph.TraversalResult;
import com.lawgraph.draftimpact.model.graph.GraphVocabulary;
import com.lawgraph.draftimpact.model.graph.Triple;
import com.lawgraph.draftimpact.model.graph.TripleStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Breadth-first walk over cross-reference edges from a single provision.
 *
 * Depth 1 covers provisions that reference the target (directly or through the inverse
 * referencedBy edge) and provisions it references or resolves to. Each further level
 * expands the previous level in the requested directions over reg:references. Every node
 * is reported once, at the shallowest depth it was reached.
 */
@Service
@Slf4j
public class ReferenceTraversalService {

    public TraversalResult traverse(TripleStore store, String targetUri, int maxDepth, TraversalDirection direction) {
        TraversalResult result = TraversalResult.builder()
                .targetUri(targetUri)
                .targetLabel(ProvisionLabels.nodeLabel(store, targetUri))
                .maxDepth(maxDepth)
                .build();

        Set<String> visited = new HashSet<>();
        visited.add(targetUri);

        if (direction.includesIncoming()) {
            for (Triple t : store.find(null, GraphVocabulary.REFERENCES, targetUri)) {
                visit(store, t.getSubject(), 1, TraversalDirection.INCOMING, visited, result.getDirectIncoming());
            }
            for (Triple t : store.find(targetUri, GraphVocabulary.REFERENCED_BY, null)) {
                visit(store, t.getObject(), 1, TraversalDirection.INCOMING, visited, result.getDirectIncoming());
            }
        }

        if (direction.includesOutgoing()) {
            for (Triple t : store.find(targetUri, GraphVocabulary.REFERENCES, null)) {
                visit(store, t.getObject(), 1, TraversalDirection.OUTGOING, visited, result.getDirectOutgoing());
            }
            for (Triple t : store.find(targetUri, GraphVocabulary.RESOLVED_TARGET, null)) {
                visit(store, t.getObject(), 1, TraversalDirection.OUTGOING, visited, result.getDirectOutgoing());
            }
        }

        if (maxDepth > 1) {
            expandTransitive(store, result, maxDepth, direction, visited);
        }

        log.debug("Traversal from {}: {} incoming, {} outgoing, {} transitive",
                targetUri, result.getDirectIncoming().size(), result.getDirectOutgoing().size(),
                result.getTransitive().size());
        return result;
    }

    private void expandTransitive(TripleStore store, TraversalResult result, int maxDepth,
                                  TraversalDirection direction, Set<String> visited) {
        List<String> frontier = new ArrayList<>();
        result.getDirectIncoming().forEach(node -> frontier.add(node.getUri()));
        result.getDirectOutgoing().forEach(node -> frontier.add(node.getUri()));

        List<String> current = frontier;
        for (int depth = 2; depth <= maxDepth && !current.isEmpty(); depth++) {
            List<String> next = new ArrayList<>();

            for (String nodeUri : current) {
                if (direction.includesIncoming()) {
                    for (Triple t : store.find(null, GraphVocabulary.REFERENCES, nodeUri)) {
                        if (visit(store, t.getSubject(), depth, TraversalDirection.INCOMING, visited, result.getTransitive())) {
                            next.add(t.getSubject());
                        }
                    }
                }
                if (direction.includesOutgoing()) {
                    for (Triple t : store.find(nodeUri, GraphVocabulary.REFERENCES, null)) {
                        if (visit(store, t.getObject(), depth, TraversalDirection.OUTGOING, visited, result.getTransitive())) {
                            next.add(t.getObject());
                        }
                    }
                }
            }

            current = next;
        }
    }

    private boolean visit(TripleStore store, String uri, int depth, TraversalDirection direction,
                          Set<String> visited, List<TraversalNode> sink) {
        if (!visited.add(uri)) {
            return false;
        }
        sink.add(TraversalNode.builder()
                .uri(uri)
                .label(ProvisionLabels.nodeLabel(store, uri))
                .nodeType(ProvisionLabels.nodeType(store, uri))
                .depth(depth)
                .direction(direction)
                .build());
        return true;
    }
}
