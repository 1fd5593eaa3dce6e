package com.purchasingpower.codegraph.knowledge;

import com.google.common.base.Preconditions;
import com.purchasingpower.codegraph.model.graph.Concept;
import com.purchasingpower.codegraph.model.graph.GraphNode;
import com.purchasingpower.codegraph.model.graph.GraphRelationship;
import com.purchasingpower.codegraph.model.graph.NodeType;
import com.purchasingpower.codegraph.model.graph.RelationshipType;
import com.purchasingpower.codegraph.util.GraphIds;
import com.purchasingpower.codegraph.util.VectorMath;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable graph owned by a single build and passed from phase to phase.
 *
 * <p>Not thread-safe: only the build thread touches it. Insertion order is
 * preserved so every phase iterates deterministically.
 */
public class WorkingGraph {

    private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
    private final Map<String, GraphRelationship> relationships = new LinkedHashMap<>();
    private final Map<String, Concept> concepts = new LinkedHashMap<>();

    /**
     * Add a node unless one with the same id exists. Importance is clamped to [0,1].
     *
     * @return true if the node was added
     */
    public boolean addNode(GraphNode node) {
        Preconditions.checkNotNull(node.getId(), "Node id cannot be null");
        if (nodes.containsKey(node.getId())) {
            return false;
        }
        node.setImportance(VectorMath.clampUnit(node.getImportance()));
        nodes.put(node.getId(), node);
        return true;
    }

    /**
     * Add an edge with default confidence unless the (from, type, to) key exists.
     *
     * @return true if the edge was added
     */
    public boolean addRelationship(String fromNodeId, String toNodeId, RelationshipType type,
                                   double weight, boolean bidirectional) {
        return addRelationship(GraphRelationship.builder()
            .fromNodeId(fromNodeId)
            .toNodeId(toNodeId)
            .type(type)
            .weight(weight)
            .bidirectional(bidirectional)
            .build());
    }

    /**
     * Add an edge unless its composite key exists. The id is always recomputed
     * from the key; weight and confidence are clamped to [0,1].
     *
     * @return true if the edge was added
     */
    public boolean addRelationship(GraphRelationship relationship) {
        Preconditions.checkNotNull(relationship.getFromNodeId(), "Relationship source cannot be null");
        Preconditions.checkNotNull(relationship.getToNodeId(), "Relationship target cannot be null");
        Preconditions.checkNotNull(relationship.getType(), "Relationship type cannot be null");

        String id = GraphIds.relationshipId(relationship.getFromNodeId(), relationship.getType(), relationship.getToNodeId());
        if (relationships.containsKey(id)) {
            return false;
        }
        relationship.setId(id);
        relationship.setWeight(VectorMath.clampUnit(relationship.getWeight()));
        relationship.setConfidence(VectorMath.clampUnit(relationship.getConfidence()));
        relationships.put(id, relationship);
        return true;
    }

    /**
     * Insert or replace a concept by id. Detectors derive ids from what they
     * matched, so re-running a detector replaces its own output.
     */
    public void putConcept(Concept concept) {
        Preconditions.checkNotNull(concept.getId(), "Concept id cannot be null");
        concept.setConfidence(VectorMath.clampUnit(concept.getConfidence()));
        concepts.put(concept.getId(), concept);
    }

    public boolean containsNode(String nodeId) {
        return nodes.containsKey(nodeId);
    }

    public Optional<GraphNode> getNode(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    public Collection<GraphNode> getNodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public List<GraphNode> getNodesOfType(NodeType type) {
        List<GraphNode> matches = new ArrayList<>();
        for (GraphNode node : nodes.values()) {
            if (node.getType() == type) {
                matches.add(node);
            }
        }
        return matches;
    }

    public Collection<GraphRelationship> getRelationships() {
        return Collections.unmodifiableCollection(relationships.values());
    }

    public Collection<Concept> getConcepts() {
        return Collections.unmodifiableCollection(concepts.values());
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

    /**
     * Copy everything into an immutable snapshot. The working graph must not
     * be used afterwards.
     */
    public KnowledgeGraph freeze(TermIndex termIndex, Path rootPath, Instant builtAt) {
        Map<String, GraphNode> frozenNodes = new LinkedHashMap<>();
        for (GraphNode node : nodes.values()) {
            frozenNodes.put(node.getId(), node.toBuilder()
                .metadata(Collections.unmodifiableMap(new LinkedHashMap<>(node.getMetadata())))
                .attributes(Collections.unmodifiableMap(new LinkedHashMap<>(node.getAttributes())))
                .semanticVector(node.getSemanticVector() != null ? node.getSemanticVector().clone() : null)
                .build());
        }

        Map<String, Concept> frozenConcepts = new LinkedHashMap<>();
        for (Concept concept : concepts.values()) {
            frozenConcepts.put(concept.getId(), Concept.builder()
                .id(concept.getId())
                .name(concept.getName())
                .description(concept.getDescription())
                .category(concept.getCategory())
                .keywords(Collections.unmodifiableSet(new LinkedHashSet<>(concept.getKeywords())))
                .relatedConcepts(Collections.unmodifiableSet(new LinkedHashSet<>(concept.getRelatedConcepts())))
                .codePatterns(Collections.unmodifiableSet(new LinkedHashSet<>(concept.getCodePatterns())))
                .confidence(concept.getConfidence())
                .affectedNodeIds(List.copyOf(concept.getAffectedNodeIds()))
                .build());
        }

        Map<String, GraphRelationship> frozenRelationships = new LinkedHashMap<>();
        relationships.forEach((id, relationship) -> frozenRelationships.put(id, relationship.copy()));

        return new KnowledgeGraph(frozenNodes, frozenRelationships, frozenConcepts,
            termIndex, rootPath, builtAt);
    }
}
