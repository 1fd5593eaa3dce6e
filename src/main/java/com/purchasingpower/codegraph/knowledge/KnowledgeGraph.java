package com.purchasingpower.codegraph.knowledge;

import com.purchasingpower.codegraph.model.graph.Concept;
import com.purchasingpower.codegraph.model.graph.GraphNode;
import com.purchasingpower.codegraph.model.graph.GraphRelationship;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable snapshot of a completed build. Safe to share between concurrent
 * queries.
 *
 * <p>The node, relationship and concept instances returned here are the
 * shared snapshot objects and must be treated as read-only. Results leaving
 * the engine through {@code QueryEngine} or {@code KnowledgeGraphService}
 * are copies.
 */
public final class KnowledgeGraph {

    private static final KnowledgeGraph EMPTY =
        new KnowledgeGraph(Map.of(), Map.of(), Map.of(), TermIndex.empty(), null, null);

    private final Map<String, GraphNode> nodes;
    private final Map<String, GraphRelationship> relationships;
    private final Map<String, Concept> concepts;
    private final TermIndex termIndex;
    private final Path rootPath;
    private final Instant builtAt;

    KnowledgeGraph(Map<String, GraphNode> nodes,
                   Map<String, GraphRelationship> relationships,
                   Map<String, Concept> concepts,
                   TermIndex termIndex,
                   Path rootPath,
                   Instant builtAt) {
        this.nodes = Collections.unmodifiableMap(nodes);
        this.relationships = Collections.unmodifiableMap(relationships);
        this.concepts = Collections.unmodifiableMap(concepts);
        this.termIndex = termIndex;
        this.rootPath = rootPath;
        this.builtAt = builtAt;
    }

    public static KnowledgeGraph empty() {
        return EMPTY;
    }

    public Optional<GraphNode> getNode(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    public Collection<GraphNode> getNodes() {
        return nodes.values();
    }

    public Collection<GraphRelationship> getRelationships() {
        return relationships.values();
    }

    public Collection<Concept> getConcepts() {
        return concepts.values();
    }

    public TermIndex getTermIndex() {
        return termIndex;
    }

    /**
     * Every relationship with either end in {@code nodeIds}, in graph order.
     */
    public List<GraphRelationship> relationshipsTouching(Set<String> nodeIds) {
        List<GraphRelationship> touching = new ArrayList<>();
        if (nodeIds.isEmpty()) {
            return touching;
        }
        for (GraphRelationship relationship : relationships.values()) {
            if (nodeIds.contains(relationship.getFromNodeId()) || nodeIds.contains(relationship.getToNodeId())) {
                touching.add(relationship);
            }
        }
        return touching;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int relationshipCount() {
        return relationships.size();
    }

    public int conceptCount() {
        return concepts.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public Optional<Path> getRootPath() {
        return Optional.ofNullable(rootPath);
    }

    public Optional<Instant> getBuiltAt() {
        return Optional.ofNullable(builtAt);
    }
}
