package com.chronicle.dependency.graph;

import com.chronicle.model.EntityRef;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Graph node. Ids are prefixed by type: {@code VARIABLE:gold}, {@code CONDITION:c-1}, {@code EFFECT:e-1},
 * {@code ENTITY:SETTLEMENT:s-1} (or {@code ENTITY:SETTLEMENT:*} for type-level rules).
 */
public record DependencyNode(String id, NodeType type, String entityId, String label, Map<String, Object> metadata) {

    public DependencyNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    public static String variableId(String name) {
        return NodeType.VARIABLE.name() + ":" + name;
    }

    public static String conditionId(String conditionId) {
        return NodeType.CONDITION.name() + ":" + conditionId;
    }

    public static String effectId(String effectId) {
        return NodeType.EFFECT.name() + ":" + effectId;
    }

    public static String entityId(EntityRef ref) {
        return NodeType.ENTITY.name() + ":" + ref.key();
    }
}
