/**
 * Dependency graph of variables, conditions, effects and entities.
 *
 * <ul>
 *   <li>{@link com.chronicle.dependency.graph.DependencyGraphBuilder} builds a
 *       {@link com.chronicle.dependency.graph.DependencyGraph} (adjacency lists keyed by node id)</li>
 *   <li>{@link com.chronicle.dependency.graph.CycleDetection}: cycle membership and cycle paths</li>
 *   <li>{@link com.chronicle.dependency.graph.GraphTraversal}: upstream, downstream, path queries</li>
 *   <li>{@link com.chronicle.dependency.graph.TopologicalOrder} and
 *       {@link com.chronicle.dependency.graph.SelectionImpact}</li>
 * </ul>
 */
package com.chronicle.dependency.graph;
