package com.purchasingpower.codegraph.knowledge;

import com.purchasingpower.codegraph.event.GraphEventListener;
import com.purchasingpower.codegraph.model.export.GraphExport;
import com.purchasingpower.codegraph.model.export.GraphStats;
import com.purchasingpower.codegraph.model.export.GraphVisualization;
import com.purchasingpower.codegraph.model.query.QueryResult;
import com.purchasingpower.codegraph.model.query.SemanticQuery;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;

/**
 * Entry point of the code knowledge-graph engine.
 *
 * <p>Handles the complete build pipeline:
 * <ol>
 *   <li>Discover source files</li>
 *   <li>Extract entities, dependencies and call sites</li>
 *   <li>Link structural relationships</li>
 *   <li>Vectorize nodes</li>
 *   <li>Discover similarity relationships</li>
 *   <li>Recognize patterns and domain concepts</li>
 *   <li>Index terms and publish the graph</li>
 * </ol>
 *
 * <p>Every build is a full rebuild. The new graph replaces the old one only
 * when the build completes; queries running meanwhile see the old graph.
 *
 * @since 1.0.0
 */
public interface KnowledgeGraphService {

    /**
     * Build the graph for a source tree.
     *
     * @param rootPath root directory of the tree
     * @return build result; failures are reported in the result, not thrown
     */
    BuildResult buildGraph(Path rootPath);

    /**
     * Build the graph for a source tree, stopping early if the token is cancelled.
     * A cancelled build leaves the previously published graph in place.
     *
     * @param rootPath root directory of the tree
     * @param cancellationToken token checked between and within phases
     * @return build result
     */
    BuildResult buildGraph(Path rootPath, CancellationToken cancellationToken);

    /**
     * Run a semantic query against the published graph.
     *
     * @param query query text, intent and filters
     * @return ranked nodes, touching relationships, suggestions and insights
     */
    QueryResult query(SemanticQuery query);

    GraphExport export();

    /**
     * Write {@link #export()} as JSON.
     */
    void writeExport(OutputStream outputStream) throws IOException;

    GraphVisualization visualize();

    GraphStats stats();

    BuildStatus getBuildStatus();

    void addListener(GraphEventListener listener);

    void removeListener(GraphEventListener listener);
}
