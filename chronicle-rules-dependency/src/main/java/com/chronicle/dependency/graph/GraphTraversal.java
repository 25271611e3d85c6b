package com.chronicle.dependency.graph;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Breadth-first reachability queries. Every query keeps a visited set, so it terminates on cyclic graphs,
 * and none of them includes the origin in its result.
 */
public final class GraphTraversal {

    private GraphTraversal() {
    }

    /**
     * Nodes that reach {@code nodeId}, following edges backwards (what depends on it, directly or not).
     *
     * @param maxDepth null or negative for unbounded; 0 yields the empty set
     */
    public static Set<String> upstream(DependencyGraph graph, String nodeId, Integer maxDepth) {
        return bfs(graph, nodeId, maxDepth, false);
    }

    /**
     * Nodes reachable from {@code nodeId} following edges forwards (what it depends on, directly or not).
     *
     * @param maxDepth null or negative for unbounded; 0 yields the empty set
     */
    public static Set<String> downstream(DependencyGraph graph, String nodeId, Integer maxDepth) {
        return bfs(graph, nodeId, maxDepth, true);
    }

    /** True when a non-empty path leads from {@code fromId} to {@code toId}. */
    public static boolean hasPath(DependencyGraph graph, String fromId, String toId) {
        if (!graph.hasNode(fromId) || !graph.hasNode(toId)) return false;
        Deque<String> queue = new ArrayDeque<>(graph.dependenciesOf(fromId));
        Set<String> visited = new HashSet<>();
        while (!queue.isEmpty()) {
            String id = queue.poll();
            if (id.equals(toId)) return true;
            if (!visited.add(id)) continue;
            queue.addAll(graph.dependenciesOf(id));
        }
        return false;
    }

    /** Whether adding an edge {@code fromId -> toId} would close a cycle. */
    public static boolean wouldCreateCycle(DependencyGraph graph, String fromId, String toId) {
        if (fromId == null || toId == null) return false;
        return fromId.equals(toId) || hasPath(graph, toId, fromId);
    }

    private static Set<String> bfs(DependencyGraph graph, String origin, Integer maxDepth, boolean forward) {
        if (!graph.hasNode(origin)) return Set.of();
        int limit = maxDepth == null || maxDepth < 0 ? Integer.MAX_VALUE : maxDepth;
        Set<String> visited = new LinkedHashSet<>();
        Set<String> frontier = Set.of(origin);
        int depth = 0;
        while (!frontier.isEmpty() && depth < limit) {
            Set<String> next = new LinkedHashSet<>();
            for (String id : frontier) {
                Set<String> neighbours = forward ? graph.dependenciesOf(id) : graph.dependents(id);
                for (String n : neighbours) {
                    if (!n.equals(origin) && visited.add(n)) next.add(n);
                }
            }
            frontier = next;
            depth++;
        }
        return Collections.unmodifiableSet(visited);
    }
}
