package com.chronicle.dependency.graph;

import java.util.List;
import java.util.Objects;

/**
 * A built graph with its cycle report, stats and the warnings collected for skipped records.
 * The graph must not be mutated once the result is shared.
 */
public final class GraphBuildResult {

    private final DependencyGraph graph;
    private final CycleReport cycles;
    private final GraphStats stats;
    private final List<String> warnings;

    public GraphBuildResult(DependencyGraph graph, CycleReport cycles, List<String> warnings) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.cycles = Objects.requireNonNull(cycles, "cycles");
        this.stats = GraphStats.of(graph, cycles);
        this.warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public DependencyGraph getGraph() {
        return graph;
    }

    public CycleReport getCycles() {
        return cycles;
    }

    public GraphStats getStats() {
        return stats;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public boolean isInCycle(String nodeId) {
        return cycles.inCycle(nodeId);
    }

    public GraphView toView() {
        List<GraphView.NodeView> nodes = graph.nodes().stream()
                .map(n -> new GraphView.NodeView(n.id(), n.type(), n.entityId(), n.label(), n.metadata(), cycles.inCycle(n.id())))
                .toList();
        return new GraphView(nodes, graph.edges(), stats, cycles.describe(), warnings);
    }
}
