package com.purchasingpower.codegraph.knowledge;

import com.purchasingpower.codegraph.model.extraction.FileExtraction;

import java.time.Instant;
import java.util.List;

/**
 * Turns extractor output and node vectors into typed, deduplicated edges.
 */
public interface RelationshipBuilder {

    /**
     * Add part_of, depends_on and calls edges, creating Module nodes for
     * external dependencies. Requires every file and entity node to be in the
     * graph already.
     *
     * @return number of edges added
     */
    int buildStructuralRelationships(WorkingGraph graph, List<FileExtraction> extractions,
                                     Instant builtAt, CancellationToken cancellationToken);

    /**
     * Add bidirectional similar_to edges between nodes with close vectors.
     * Requires every node to be vectorized.
     *
     * @return number of edges added
     */
    int buildSimilarityRelationships(WorkingGraph graph, CancellationToken cancellationToken);
}
