package com.chronicle.dependency.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * Kahn ordering of a dependency graph, dependencies first: a variable comes before the conditions that
 * read it. Ties break lexically by node id. Nodes on or behind a cycle cannot be ordered and are listed in
 * {@code unordered}.
 */
public record TopologicalOrder(List<String> order, List<String> unordered) {

    public TopologicalOrder {
        order = order != null ? List.copyOf(order) : List.of();
        unordered = unordered != null ? List.copyOf(unordered) : List.of();
    }

    public boolean isComplete() {
        return unordered.isEmpty();
    }

    public static TopologicalOrder of(DependencyGraph graph) {
        Map<String, Integer> inDegree = new HashMap<>();
        for (String id : graph.nodeIds()) inDegree.put(id, graph.dependents(id).size());
        PriorityQueue<String> ready = new PriorityQueue<>();
        inDegree.forEach((id, d) -> {
            if (d == 0) ready.add(id);
        });
        List<String> sorted = new ArrayList<>();
        while (!ready.isEmpty()) {
            String id = ready.poll();
            sorted.add(id);
            for (String target : graph.dependenciesOf(id)) {
                int d = inDegree.merge(target, -1, Integer::sum);
                if (d == 0) ready.add(target);
            }
        }
        List<String> remaining = new ArrayList<>();
        for (String id : graph.nodeIds()) {
            if (inDegree.get(id) > 0) remaining.add(id);
        }
        Collections.sort(remaining);
        Collections.reverse(sorted);
        return new TopologicalOrder(sorted, remaining);
    }
}
