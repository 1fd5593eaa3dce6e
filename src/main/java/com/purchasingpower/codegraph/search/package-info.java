/**
 * Query answering over a published knowledge graph.
 *
 * <p>Key classes:
 * <ul>
 *   <li>{@code QueryEngine} - ranks nodes for a query and assembles suggestions</li>
 *   <li>{@code InsightExtractor} - hubs, cycles and isolated nodes in a result subgraph</li>
 * </ul>
 *
 * <p>Both are pure functions of their inputs: the same query against the
 * same graph always gives the same result.
 *
 * @since 1.0.0
 */
package com.purchasingpower.codegraph.search;
