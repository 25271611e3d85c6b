package com.chronicle.dependency.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Directed multigraph of dependency nodes with adjacency lists keyed by node id. May contain cycles.
 * Not thread-safe: build it on one thread, then only read it (or hand out {@link #copy()}s).
 */
public final class DependencyGraph {

    private final Map<String, DependencyNode> nodes = new LinkedHashMap<>();
    private final Map<String, List<DependencyEdge>> outgoing = new LinkedHashMap<>();
    private final Map<String, List<DependencyEdge>> incoming = new LinkedHashMap<>();
    private int edgeCount;

    /** Adds the node unless a node with the same id exists; returns the node now stored under the id. */
    public DependencyNode addNode(DependencyNode node) {
        Objects.requireNonNull(node, "node");
        DependencyNode existing = nodes.putIfAbsent(node.id(), node);
        if (existing != null) return existing;
        outgoing.put(node.id(), new ArrayList<>());
        incoming.put(node.id(), new ArrayList<>());
        return node;
    }

    /**
     * Adds an edge between existing nodes. An identical edge (same endpoints and type) is not added twice.
     *
     * @return true if the edge was added
     * @throws IllegalArgumentException when either endpoint is not in the graph
     */
    public boolean addEdge(DependencyEdge edge) {
        Objects.requireNonNull(edge, "edge");
        if (!nodes.containsKey(edge.fromId())) throw new IllegalArgumentException("Unknown node: " + edge.fromId());
        if (!nodes.containsKey(edge.toId())) throw new IllegalArgumentException("Unknown node: " + edge.toId());
        List<DependencyEdge> out = outgoing.get(edge.fromId());
        for (DependencyEdge e : out) {
            if (e.toId().equals(edge.toId()) && e.type() == edge.type()) return false;
        }
        out.add(edge);
        incoming.get(edge.toId()).add(edge);
        edgeCount++;
        return true;
    }

    /** Removes the node and every edge touching it. Returns false if the node was absent. */
    public boolean removeNode(String nodeId) {
        if (nodeId == null || !nodes.containsKey(nodeId)) return false;
        for (DependencyEdge e : new ArrayList<>(outgoing.get(nodeId))) removeEdge(e);
        for (DependencyEdge e : new ArrayList<>(incoming.get(nodeId))) removeEdge(e);
        nodes.remove(nodeId);
        outgoing.remove(nodeId);
        incoming.remove(nodeId);
        return true;
    }

    /** Removes every edge from {@code fromId} to {@code toId}, whatever its type. Returns the number removed. */
    public int removeEdges(String fromId, String toId) {
        List<DependencyEdge> out = outgoing.get(fromId);
        if (out == null) return 0;
        int removed = 0;
        for (DependencyEdge e : new ArrayList<>(out)) {
            if (e.toId().equals(toId) && removeEdge(e)) removed++;
        }
        return removed;
    }

    public boolean removeEdge(DependencyEdge edge) {
        List<DependencyEdge> out = outgoing.get(edge.fromId());
        if (out == null || !out.remove(edge)) return false;
        incoming.get(edge.toId()).remove(edge);
        edgeCount--;
        return true;
    }

    public boolean hasNode(String nodeId) {
        return nodeId != null && nodes.containsKey(nodeId);
    }

    /** Returns the node, or null if absent. */
    public DependencyNode getNode(String nodeId) {
        return nodeId != null ? nodes.get(nodeId) : null;
    }

    public Collection<DependencyNode> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public Set<String> nodeIds() {
        return Collections.unmodifiableSet(nodes.keySet());
    }

    public List<DependencyEdge> edges() {
        List<DependencyEdge> all = new ArrayList<>(edgeCount);
        for (List<DependencyEdge> out : outgoing.values()) all.addAll(out);
        return Collections.unmodifiableList(all);
    }

    public List<DependencyEdge> outgoing(String nodeId) {
        List<DependencyEdge> out = nodeId != null ? outgoing.get(nodeId) : null;
        return out != null ? Collections.unmodifiableList(out) : List.of();
    }

    public List<DependencyEdge> incoming(String nodeId) {
        List<DependencyEdge> in = nodeId != null ? incoming.get(nodeId) : null;
        return in != null ? Collections.unmodifiableList(in) : List.of();
    }

    /** Distinct direct targets of the node's outgoing edges: what it depends on. */
    public Set<String> dependenciesOf(String nodeId) {
        Set<String> out = new LinkedHashSet<>();
        for (DependencyEdge e : outgoing(nodeId)) out.add(e.toId());
        return Collections.unmodifiableSet(out);
    }

    /** Distinct direct sources of the node's incoming edges: what depends on it. */
    public Set<String> dependents(String nodeId) {
        Set<String> in = new LinkedHashSet<>();
        for (DependencyEdge e : incoming(nodeId)) in.add(e.fromId());
        return Collections.unmodifiableSet(in);
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edgeCount;
    }

    public DependencyGraph copy() {
        DependencyGraph g = new DependencyGraph();
        for (DependencyNode n : nodes.values()) g.addNode(n);
        for (List<DependencyEdge> out : outgoing.values()) {
            for (DependencyEdge e : out) g.addEdge(e);
        }
        return g;
    }
}
