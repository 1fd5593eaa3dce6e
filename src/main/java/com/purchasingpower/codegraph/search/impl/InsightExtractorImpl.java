package com.purchasingpower.codegraph.search.impl;

import com.purchasingpower.codegraph.configuration.CodeGraphProperties;
import com.purchasingpower.codegraph.model.graph.GraphNode;
import com.purchasingpower.codegraph.model.graph.GraphRelationship;
import com.purchasingpower.codegraph.model.query.GraphInsight;
import com.purchasingpower.codegraph.model.query.InsightType;
import com.purchasingpower.codegraph.search.InsightExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Connectivity, cycle and isolation analysis over a result subgraph.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InsightExtractorImpl implements InsightExtractor {

    private final CodeGraphProperties properties;

    @Override
    public List<GraphInsight> extract(List<GraphNode> nodes, List<GraphRelationship> relationships) {
        List<GraphInsight> insights = new ArrayList<>();
        insights.addAll(findHighlyConnected(nodes, relationships));
        insights.addAll(findCycles(nodes, relationships));
        insights.addAll(findIsolated(nodes, relationships));
        log.debug("Extracted {} insights from {} nodes and {} relationships",
            insights.size(), nodes.size(), relationships.size());
        return insights;
    }

    private List<GraphInsight> findHighlyConnected(List<GraphNode> nodes, List<GraphRelationship> relationships) {
        Map<String, Integer> connectionCounts = new HashMap<>();
        for (GraphRelationship relationship : relationships) {
            connectionCounts.merge(relationship.getFromNodeId(), 1, Integer::sum);
            connectionCounts.merge(relationship.getToNodeId(), 1, Integer::sum);
        }

        List<GraphInsight> insights = new ArrayList<>();
        for (GraphNode node : nodes) {
            int count = connectionCounts.getOrDefault(node.getId(), 0);
            if (count > properties.getHubConnectionThreshold()) {
                insights.add(GraphInsight.builder()
                    .type(InsightType.ARCHITECTURE)
                    .title("Highly Connected Component")
                    .description(node.getName() + " has " + count
                        + " connections and may be a central architectural component")
                    .confidence(Math.min(0.9, count / 20.0))
                    .actionable(true)
                    .suggestion("Consider reviewing for single responsibility principle")
                    .affectedNodes(new ArrayList<>(List.of(node.getId())))
                    .build());
            }
        }
        return insights;
    }

    private List<GraphInsight> findCycles(List<GraphNode> nodes, List<GraphRelationship> relationships) {
        Map<String, String> names = new HashMap<>();
        for (GraphNode node : nodes) {
            names.put(node.getId(), node.getName());
        }

        List<GraphInsight> insights = new ArrayList<>();
        for (List<String> cycle : detectCycles(relationships, properties.getMaxReportedCycles())) {
            List<String> labels = new ArrayList<>();
            for (String id : cycle) {
                labels.add(names.getOrDefault(id, id));
            }
            labels.add(labels.get(0));

            insights.add(GraphInsight.builder()
                .type(InsightType.VULNERABILITY)
                .title("Circular Dependency Detected")
                .description("Cycle through " + cycle.size() + " components: " + String.join(" -> ", labels))
                .confidence(0.8)
                .actionable(true)
                .suggestion("Refactor to break circular dependencies")
                .affectedNodes(new ArrayList<>(cycle))
                .build());
        }
        return insights;
    }

    private List<GraphInsight> findIsolated(List<GraphNode> nodes, List<GraphRelationship> relationships) {
        Set<String> connected = new HashSet<>();
        for (GraphRelationship relationship : relationships) {
            connected.add(relationship.getFromNodeId());
            connected.add(relationship.getToNodeId());
        }

        List<String> isolated = new ArrayList<>();
        for (GraphNode node : nodes) {
            if (!connected.contains(node.getId())) {
                isolated.add(node.getId());
            }
        }
        if (isolated.isEmpty()) {
            return List.of();
        }

        return List.of(GraphInsight.builder()
            .type(InsightType.ANOMALY)
            .title("Isolated Components")
            .description("Found " + isolated.size() + " components with no relationships")
            .confidence(0.7)
            .actionable(true)
            .suggestion("Review if these components are still needed")
            .affectedNodes(isolated)
            .build());
    }

    /**
     * Depth-first search over directed edges. Bidirectional edges (similarity)
     * are ignored, since each would be a trivial two-node cycle. A back edge
     * into the current path yields the path from the repeated node onwards.
     *
     * @param maxCycles stop after this many cycles
     */
    static List<List<String>> detectCycles(List<GraphRelationship> relationships, int maxCycles) {
        Map<String, List<String>> adjacency = new LinkedHashMap<>();
        for (GraphRelationship relationship : relationships) {
            if (relationship.isBidirectional()) {
                continue;
            }
            adjacency.computeIfAbsent(relationship.getFromNodeId(), k -> new ArrayList<>())
                .add(relationship.getToNodeId());
        }

        List<List<String>> cycles = new ArrayList<>();
        Set<String> visited = new HashSet<>();

        for (String start : adjacency.keySet()) {
            if (visited.contains(start)) {
                continue;
            }

            List<String> path = new ArrayList<>();
            Set<String> onPath = new HashSet<>();
            Deque<int[]> cursors = new ArrayDeque<>();

            visited.add(start);
            path.add(start);
            onPath.add(start);
            cursors.push(new int[] {0});

            while (!path.isEmpty()) {
                String current = path.get(path.size() - 1);
                List<String> neighbours = adjacency.getOrDefault(current, List.of());
                int[] cursor = cursors.peek();

                if (cursor[0] >= neighbours.size()) {
                    onPath.remove(current);
                    path.remove(path.size() - 1);
                    cursors.pop();
                    continue;
                }

                String next = neighbours.get(cursor[0]++);
                if (onPath.contains(next)) {
                    cycles.add(new ArrayList<>(path.subList(path.indexOf(next), path.size())));
                    if (cycles.size() >= maxCycles) {
                        return cycles;
                    }
                } else if (visited.add(next)) {
                    path.add(next);
                    onPath.add(next);
                    cursors.push(new int[] {0});
                }
            }
        }
        return cycles;
    }
}
