package com.chronicle.dependency.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Directed edge {@code fromId -> toId}. Parallel edges of different types are allowed. */
public record DependencyEdge(String fromId, String toId, EdgeType type, Map<String, Object> metadata) {

    public DependencyEdge {
        Objects.requireNonNull(fromId, "fromId");
        Objects.requireNonNull(toId, "toId");
        Objects.requireNonNull(type, "type");
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    public static DependencyEdge of(String fromId, String toId, EdgeType type) {
        return new DependencyEdge(fromId, toId, type, Map.of());
    }
}
