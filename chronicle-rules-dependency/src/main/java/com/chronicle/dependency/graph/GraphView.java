package com.chronicle.dependency.graph;

import java.util.List;
import java.util.Map;

/**
 * Immutable {@code {nodes, edges, stats}} projection of a built graph for callers outside the engine.
 * Each node carries its {@code inCycle} flag.
 */
public record GraphView(List<NodeView> nodes, List<DependencyEdge> edges, GraphStats stats, List<String> cycles, List<String> warnings) {

    public record NodeView(String id, NodeType type, String entityId, String label, Map<String, Object> metadata, boolean inCycle) {
    }

    public GraphView {
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        edges = edges != null ? List.copyOf(edges) : List.of();
        cycles = cycles != null ? List.copyOf(cycles) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    /** Returns the node view, or null. */
    public NodeView node(String id) {
        for (NodeView n : nodes) {
            if (n.id().equals(id)) return n;
        }
        return null;
    }
}
