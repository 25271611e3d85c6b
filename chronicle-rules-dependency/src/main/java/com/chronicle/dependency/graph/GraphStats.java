package com.chronicle.dependency.graph;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/** Node counts per type, edge count and the number of nodes that sit on a cycle. */
public record GraphStats(Map<NodeType, Integer> nodesByType, int nodeCount, int edgeCount, int cycleParticipants) {

    public GraphStats {
        Map<NodeType, Integer> counts = new EnumMap<>(NodeType.class);
        for (NodeType t : NodeType.values()) counts.put(t, 0);
        if (nodesByType != null) counts.putAll(nodesByType);
        nodesByType = Collections.unmodifiableMap(counts);
    }

    public static GraphStats of(DependencyGraph graph, CycleReport cycles) {
        Map<NodeType, Integer> counts = new EnumMap<>(NodeType.class);
        for (DependencyNode n : graph.nodes()) counts.merge(n.type(), 1, Integer::sum);
        return new GraphStats(counts, graph.nodeCount(), graph.edgeCount(), cycles.nodesInCycles().size());
    }

    public int count(NodeType type) {
        return nodesByType.getOrDefault(type, 0);
    }
}
