package com.purchasingpower.codegraph.knowledge.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.purchasingpower.codegraph.event.GraphBuiltEvent;
import com.purchasingpower.codegraph.event.GraphEventListener;
import com.purchasingpower.codegraph.event.GraphEventPublisher;
import com.purchasingpower.codegraph.event.QueryExecutedEvent;
import com.purchasingpower.codegraph.exception.BuildCancelledException;
import com.purchasingpower.codegraph.exception.GraphBuildException;
import com.purchasingpower.codegraph.knowledge.BuildResult;
import com.purchasingpower.codegraph.knowledge.BuildState;
import com.purchasingpower.codegraph.knowledge.BuildStatus;
import com.purchasingpower.codegraph.knowledge.CancellationToken;
import com.purchasingpower.codegraph.knowledge.GraphStore;
import com.purchasingpower.codegraph.knowledge.KnowledgeGraph;
import com.purchasingpower.codegraph.knowledge.KnowledgeGraphService;
import com.purchasingpower.codegraph.knowledge.NodeDescriptionGenerator;
import com.purchasingpower.codegraph.knowledge.PatternRecognizer;
import com.purchasingpower.codegraph.knowledge.RelationshipBuilder;
import com.purchasingpower.codegraph.knowledge.SemanticVectorizer;
import com.purchasingpower.codegraph.knowledge.TermIndex;
import com.purchasingpower.codegraph.knowledge.WorkingGraph;
import com.purchasingpower.codegraph.model.export.ExportMetadata;
import com.purchasingpower.codegraph.model.export.GraphExport;
import com.purchasingpower.codegraph.model.export.GraphStats;
import com.purchasingpower.codegraph.model.export.GraphVisualization;
import com.purchasingpower.codegraph.model.export.VisualEdge;
import com.purchasingpower.codegraph.model.export.VisualNode;
import com.purchasingpower.codegraph.model.extraction.ExtractionReport;
import com.purchasingpower.codegraph.model.extraction.FileExtraction;
import com.purchasingpower.codegraph.model.graph.Concept;
import com.purchasingpower.codegraph.model.graph.GraphNode;
import com.purchasingpower.codegraph.model.graph.GraphRelationship;
import com.purchasingpower.codegraph.model.graph.NodeType;
import com.purchasingpower.codegraph.model.graph.RelationshipType;
import com.purchasingpower.codegraph.model.query.QueryResult;
import com.purchasingpower.codegraph.model.query.SemanticQuery;
import com.purchasingpower.codegraph.parser.EntityExtractor;
import com.purchasingpower.codegraph.parser.FileDiscovery;
import com.purchasingpower.codegraph.search.QueryEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * In-memory implementation of KnowledgeGraphService.
 *
 * <p>Builds run one at a time on the calling thread; only extraction fans
 * out to the worker pool. Each build assembles a private {@link WorkingGraph}
 * and publishes a frozen snapshot at the very end, so a failed or cancelled
 * build never disturbs the graph queries are reading.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class KnowledgeGraphServiceImpl implements KnowledgeGraphService {

    static final String EXPORT_VERSION = "1.0.0";
    static final double VISUAL_SIZE_SCALE = 20.0;

    private final FileDiscovery fileDiscovery;
    private final EntityExtractor entityExtractor;
    private final SemanticVectorizer vectorizer;
    private final NodeDescriptionGenerator descriptionGenerator;
    private final RelationshipBuilder relationshipBuilder;
    private final PatternRecognizer patternRecognizer;
    private final GraphStore graphStore;
    private final QueryEngine queryEngine;
    private final GraphEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;

    private final ReentrantLock buildLock = new ReentrantLock();
    private final AtomicReference<BuildStatus> buildStatus = new AtomicReference<>(BuildStatusImpl.notStarted());

    @Override
    public BuildResult buildGraph(Path rootPath) {
        return buildGraph(rootPath, CancellationToken.none());
    }

    @Override
    public BuildResult buildGraph(Path rootPath, CancellationToken cancellationToken) {
        Preconditions.checkNotNull(rootPath, "Root path cannot be null");
        Preconditions.checkNotNull(cancellationToken, "Cancellation token cannot be null");

        Path root = rootPath.toAbsolutePath().normalize();
        String rootName = root.toString();

        buildLock.lock();
        long startTime = System.currentTimeMillis();
        try {
            log.info("Starting graph build for {}", root);
            Instant builtAt = Instant.now();
            WorkingGraph graph = new WorkingGraph();

            updateStatus(rootName, BuildState.DISCOVERING, 5, "Discovering source files", startTime);
            List<Path> files = fileDiscovery.discover(root, cancellationToken);

            updateStatus(rootName, BuildState.EXTRACTING, 15, "Extracting entities from " + files.size() + " files", startTime);
            ExtractionReport report = entityExtractor.extract(root, files, builtAt, cancellationToken);
            for (FileExtraction extraction : report.getExtractions()) {
                graph.addNode(extraction.getFileNode());
                extraction.getEntityNodes().forEach(graph::addNode);
            }

            updateStatus(rootName, BuildState.LINKING, 40, "Linking dependencies and calls", startTime);
            relationshipBuilder.buildStructuralRelationships(graph, report.getExtractions(), builtAt, cancellationToken);

            updateStatus(rootName, BuildState.VECTORIZING, 55, "Vectorizing " + graph.nodeCount() + " nodes", startTime);
            vectorizeNodes(graph, cancellationToken);

            updateStatus(rootName, BuildState.DISCOVERING_SIMILARITY, 70, "Discovering similar nodes", startTime);
            relationshipBuilder.buildSimilarityRelationships(graph, cancellationToken);

            updateStatus(rootName, BuildState.RECOGNIZING_PATTERNS, 85, "Recognizing patterns", startTime);
            cancellationToken.throwIfCancellationRequested("pattern recognition");
            patternRecognizer.recognize(graph);

            updateStatus(rootName, BuildState.INDEXING, 95, "Indexing terms", startTime);
            TermIndex termIndex = buildTermIndex(graph, cancellationToken);

            cancellationToken.throwIfCancellationRequested("publish");
            KnowledgeGraph snapshot = graph.freeze(termIndex, root, builtAt);
            graphStore.publish(snapshot);

            long duration = System.currentTimeMillis() - startTime;
            buildStatus.set(BuildStatusImpl.completed(rootName, startTime));
            log.info("Graph build completed for {}: {} nodes, {} relationships, {} concepts in {}ms",
                root, snapshot.nodeCount(), snapshot.relationshipCount(), snapshot.conceptCount(), duration);

            eventPublisher.publishGraphBuilt(new GraphBuiltEvent(
                root, snapshot.nodeCount(), snapshot.relationshipCount(), snapshot.conceptCount(), duration));

            return BuildResultImpl.builder()
                .success(true)
                .rootPath(rootName)
                .nodeCount(snapshot.nodeCount())
                .relationshipCount(snapshot.relationshipCount())
                .conceptCount(snapshot.conceptCount())
                .filesProcessed(report.getExtractions().size())
                .filesSkipped(report.getFilesSkipped())
                .durationMs(duration)
                .errors(new ArrayList<>(report.getErrors()))
                .build();

        } catch (BuildCancelledException e) {
            log.warn("{}; keeping the previously published graph", e.getMessage());
            buildStatus.set(BuildStatusImpl.cancelled(rootName, startTime));
            return BuildResultImpl.failure(rootName, e.getMessage(), System.currentTimeMillis() - startTime);

        } catch (GraphBuildException e) {
            log.error("Graph build failed for {}: {}", root, e.getMessage(), e);
            buildStatus.set(BuildStatusImpl.failed(rootName, e.getMessage(), startTime));
            return BuildResultImpl.failure(rootName, e.getMessage(), System.currentTimeMillis() - startTime);

        } catch (RuntimeException e) {
            log.error("Unexpected error while building graph for {}: {}", root, e.getMessage(), e);
            buildStatus.set(BuildStatusImpl.failed(rootName, e.getMessage(), startTime));
            return BuildResultImpl.failure(rootName, "Unexpected error: " + e.getMessage(),
                System.currentTimeMillis() - startTime);

        } finally {
            buildLock.unlock();
        }
    }

    @Override
    public QueryResult query(SemanticQuery query) {
        long start = System.nanoTime();
        QueryResult result = queryEngine.query(graphStore.current(), query);
        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        String text = query != null && query.getText() != null ? query.getText() : "";
        eventPublisher.publishQueryExecuted(new QueryExecutedEvent(
            text, result.getNodes().size(), durationMs, result.getRelevanceScore()));
        return result;
    }

    @Override
    public GraphExport export() {
        KnowledgeGraph graph = graphStore.current();
        return GraphExport.builder()
            .nodes(graph.getNodes().stream().map(GraphNode::copy).collect(Collectors.toList()))
            .relationships(graph.getRelationships().stream().map(GraphRelationship::copy).collect(Collectors.toList()))
            .concepts(graph.getConcepts().stream().map(Concept::copy).collect(Collectors.toList()))
            .metadata(ExportMetadata.builder()
                .exportDate(Instant.now())
                .version(EXPORT_VERSION)
                .rootPath(graph.getRootPath().map(Path::toString).orElse(null))
                .builtAt(graph.getBuiltAt().orElse(null))
                .build())
            .build();
    }

    @Override
    public void writeExport(OutputStream outputStream) throws IOException {
        Preconditions.checkNotNull(outputStream, "Output stream cannot be null");
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(outputStream, export());
    }

    @Override
    public GraphVisualization visualize() {
        KnowledgeGraph graph = graphStore.current();

        List<VisualNode> nodes = new ArrayList<>(graph.nodeCount());
        for (GraphNode node : graph.getNodes()) {
            nodes.add(VisualNode.builder()
                .id(node.getId())
                .label(node.getName())
                .type(node.getType())
                .size(node.getImportance() * VISUAL_SIZE_SCALE)
                .color(colorFor(node.getType()))
                .build());
        }

        List<VisualEdge> edges = new ArrayList<>(graph.relationshipCount());
        for (GraphRelationship relationship : graph.getRelationships()) {
            edges.add(VisualEdge.builder()
                .id(relationship.getId())
                .source(relationship.getFromNodeId())
                .target(relationship.getToNodeId())
                .label(relationship.getType().wireName())
                .weight(relationship.getWeight())
                .build());
        }

        return GraphVisualization.builder()
            .nodes(nodes)
            .edges(edges)
            .build();
    }

    @Override
    public GraphStats stats() {
        KnowledgeGraph graph = graphStore.current();

        Map<NodeType, Integer> nodeTypes = new EnumMap<>(NodeType.class);
        graph.getNodes().forEach(node -> nodeTypes.merge(node.getType(), 1, Integer::sum));

        Map<RelationshipType, Integer> relationshipTypes = new EnumMap<>(RelationshipType.class);
        graph.getRelationships().forEach(rel -> relationshipTypes.merge(rel.getType(), 1, Integer::sum));

        Map<String, Integer> nodeTypeDistribution = new LinkedHashMap<>();
        nodeTypes.forEach((type, count) -> nodeTypeDistribution.put(type.wireName(), count));
        Map<String, Integer> relationshipTypeDistribution = new LinkedHashMap<>();
        relationshipTypes.forEach((type, count) -> relationshipTypeDistribution.put(type.wireName(), count));

        return GraphStats.builder()
            .nodeCount(graph.nodeCount())
            .relationshipCount(graph.relationshipCount())
            .conceptCount(graph.conceptCount())
            .nodeTypeDistribution(nodeTypeDistribution)
            .relationshipTypeDistribution(relationshipTypeDistribution)
            .build();
    }

    @Override
    public BuildStatus getBuildStatus() {
        return buildStatus.get();
    }

    @Override
    public void addListener(GraphEventListener listener) {
        eventPublisher.addListener(listener);
    }

    @Override
    public void removeListener(GraphEventListener listener) {
        eventPublisher.removeListener(listener);
    }

    private void vectorizeNodes(WorkingGraph graph, CancellationToken cancellationToken) {
        for (GraphNode node : graph.getNodes()) {
            cancellationToken.throwIfCancellationRequested("vectorization");
            node.setSemanticVector(vectorizer.vectorize(descriptionGenerator.describe(node)));
        }
        log.info("Vectorized {} nodes ({} cached vectors)", graph.nodeCount(), vectorizer.cacheSize());
    }

    private TermIndex buildTermIndex(WorkingGraph graph, CancellationToken cancellationToken) {
        TermIndex.Builder builder = TermIndex.builder();
        for (GraphNode node : graph.getNodes()) {
            cancellationToken.throwIfCancellationRequested("indexing");
            builder.add(node.getId(), vectorizer.tokenize(descriptionGenerator.describe(node)));
        }
        TermIndex termIndex = builder.build();
        log.debug("Indexed {} terms", termIndex.termCount());
        return termIndex;
    }

    private void updateStatus(String rootPath, BuildState state, int progress, String step, long startedAt) {
        buildStatus.set(BuildStatusImpl.inProgress(rootPath, state, progress, step, startedAt));
        log.debug("Build status: {} - {} ({}%)", rootPath, step, progress);
    }

    static String colorFor(NodeType type) {
        if (type == null) {
            return "#95a5a6";
        }
        return switch (type) {
            case FILE -> "#3498db";
            case FUNCTION -> "#2ecc71";
            case CLASS -> "#e74c3c";
            case INTERFACE -> "#f39c12";
            case VARIABLE -> "#9b59b6";
            case MODULE -> "#1abc9c";
            case CONCEPT -> "#e67e22";
        };
    }
}
