package com.chronicle.patch;

import com.chronicle.model.JsonValues;
import com.chronicle.model.VariableState;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structural difference between two variable states, by variable name: {@code added} (new value),
 * {@code modified} (old and new value) and {@code removed} (old value). Numbers compare by value.
 */
public record VariableDiff(Map<String, JsonNode> added, Map<String, ValueChange> modified, Map<String, JsonNode> removed) {

    /** Old and new value of one modified variable. */
    public record ValueChange(JsonNode oldValue, JsonNode newValue) {
    }

    public VariableDiff {
        added = added != null ? Collections.unmodifiableMap(new LinkedHashMap<>(added)) : Map.of();
        modified = modified != null ? Collections.unmodifiableMap(new LinkedHashMap<>(modified)) : Map.of();
        removed = removed != null ? Collections.unmodifiableMap(new LinkedHashMap<>(removed)) : Map.of();
    }

    public static VariableDiff empty() {
        return new VariableDiff(Map.of(), Map.of(), Map.of());
    }

    public static VariableDiff between(VariableState before, VariableState after) {
        Map<String, JsonNode> added = new LinkedHashMap<>();
        Map<String, ValueChange> modified = new LinkedHashMap<>();
        Map<String, JsonNode> removed = new LinkedHashMap<>();
        for (String name : before.names()) {
            if (!after.contains(name)) {
                removed.put(name, before.get(name));
            } else if (!JsonValues.deepEquals(before.get(name), after.get(name))) {
                modified.put(name, new ValueChange(before.get(name), after.get(name)));
            }
        }
        for (String name : after.names()) {
            if (!before.contains(name)) added.put(name, after.get(name));
        }
        return new VariableDiff(added, modified, removed);
    }

    public boolean isEmpty() {
        return added.isEmpty() && modified.isEmpty() && removed.isEmpty();
    }

    /** Number of variables touched. */
    public int size() {
        return added.size() + modified.size() + removed.size();
    }
}
