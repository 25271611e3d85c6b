package com.chronicle.dependency.graph;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Cycle membership plus one representative path per DFS back edge ({@code [a, b, a]}).
 * {@code nodesInCycles} is exact: a node is in it iff it lies on some directed cycle.
 */
public record CycleReport(Set<String> nodesInCycles, List<List<String>> cycles) {

    public CycleReport {
        nodesInCycles = nodesInCycles != null ? Collections.unmodifiableSet(new LinkedHashSet<>(nodesInCycles)) : Set.of();
        cycles = cycles != null ? cycles.stream().map(List::copyOf).toList() : List.of();
    }

    public boolean hasCycles() {
        return !nodesInCycles.isEmpty();
    }

    public boolean inCycle(String nodeId) {
        return nodesInCycles.contains(nodeId);
    }

    /** Cycle paths rendered as {@code a -> b -> a}. */
    public List<String> describe() {
        return cycles.stream().map(c -> String.join(" -> ", c)).toList();
    }
}
