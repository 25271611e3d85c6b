package com.chronicle.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable mapping from variable name to JSON value for one entity instance.
 * Only the patch engine produces new states; every accessor returns copies so callers cannot mutate it.
 */
public final class VariableState {

    private static final VariableState EMPTY = new VariableState(JsonNodeFactory.instance.objectNode());

    private final ObjectNode values;

    private VariableState(ObjectNode values) {
        this.values = values;
    }

    public static VariableState empty() {
        return EMPTY;
    }

    /**
     * Builds a state from a JSON object (deep-copied). Null or non-object input yields the empty state.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static VariableState of(JsonNode node) {
        if (node == null || !node.isObject() || node.isEmpty()) return EMPTY;
        return new VariableState(((ObjectNode) node).deepCopy());
    }

    public static VariableState of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) return EMPTY;
        return of((JsonNode) RulesJson.mapper().valueToTree(values));
    }

    /** Value for the variable, or null when absent. The returned node is a copy. */
    public JsonNode get(String name) {
        JsonNode v = values.get(name);
        return v != null ? v.deepCopy() : null;
    }

    public boolean contains(String name) {
        return values.has(name);
    }

    /** Variable names in insertion order. */
    public List<String> names() {
        List<String> out = new ArrayList<>();
        Iterator<String> it = values.fieldNames();
        while (it.hasNext()) out.add(it.next());
        return Collections.unmodifiableList(out);
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /** Deep copy of the underlying object, safe to mutate. */
    @JsonValue
    public ObjectNode toObjectNode() {
        return values.deepCopy();
    }

    /** Plain Java view (maps, lists, numbers, strings) suitable for logging or export. */
    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = values.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            out.put(e.getKey(), RulesJson.mapper().convertValue(e.getValue(), Object.class));
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VariableState)) return false;
        return values.equals(((VariableState) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
