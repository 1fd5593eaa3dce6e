/**
 * Knowledge graph construction: vectorization, relationship building,
 * pattern recognition and the engine facade.
 *
 * <p>Key classes:
 * <ul>
 *   <li>{@code KnowledgeGraphService} - build, query, export, visualize, stats</li>
 *   <li>{@code WorkingGraph} - mutable graph owned by a single build</li>
 *   <li>{@code KnowledgeGraph} - immutable snapshot published after a build</li>
 *   <li>{@code GraphStore} - holds the published snapshot</li>
 *   <li>{@code SemanticVectorizer} - text to fixed-dimension vectors</li>
 *   <li>{@code SimilarityIndex} - pairwise similarity discovery</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.purchasingpower.codegraph.knowledge;
