package com.chronicle.dependency.graph;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Combined reach of a multi-node selection, for highlighting: the union of every selected node's upstream
 * and downstream sets. Selected nodes appear in {@code upstream}/{@code downstream} only when another
 * selected node reaches them.
 */
public record SelectionImpact(Set<String> selected, Set<String> upstream, Set<String> downstream) {

    public SelectionImpact {
        selected = selected != null ? Collections.unmodifiableSet(new LinkedHashSet<>(selected)) : Set.of();
        upstream = upstream != null ? Collections.unmodifiableSet(new LinkedHashSet<>(upstream)) : Set.of();
        downstream = downstream != null ? Collections.unmodifiableSet(new LinkedHashSet<>(downstream)) : Set.of();
    }

    /** Unknown ids are ignored. */
    public static SelectionImpact of(DependencyGraph graph, Collection<String> nodeIds, Integer maxDepth) {
        Set<String> selected = new LinkedHashSet<>();
        Set<String> up = new LinkedHashSet<>();
        Set<String> down = new LinkedHashSet<>();
        if (nodeIds != null) {
            for (String id : nodeIds) {
                if (!graph.hasNode(id)) continue;
                selected.add(id);
                up.addAll(GraphTraversal.upstream(graph, id, maxDepth));
                down.addAll(GraphTraversal.downstream(graph, id, maxDepth));
            }
        }
        return new SelectionImpact(selected, up, down);
    }

    /** Every node to highlight: the selection plus everything it reaches in either direction. */
    public Set<String> highlighted() {
        Set<String> all = new LinkedHashSet<>(selected);
        all.addAll(upstream);
        all.addAll(downstream);
        return Collections.unmodifiableSet(all);
    }
}
