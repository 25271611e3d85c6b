package com.chronicle.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One RFC-6902-shaped patch instruction as it arrives on the wire: {@code {op, path, value?, from?}}.
 * <p>
 * The raw JSON is kept as-is so that validation can report exactly what was sent (missing fields,
 * non-string paths, unknown extra fields, a {@code value} that is present but {@code null}).
 * Accessors never throw; they return null when the field is absent or has the wrong JSON type.
 */
public final class PatchOp {

    private static final Set<String> KNOWN_FIELDS = Set.of("op", "path", "value", "from");

    private final JsonNode raw;

    private PatchOp(JsonNode raw) {
        this.raw = raw != null ? raw.deepCopy() : NullNode.getInstance();
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static PatchOp fromJson(JsonNode node) {
        return new PatchOp(node);
    }

    public static PatchOp add(String path, JsonNode value) {
        return of(PatchOpType.ADD, path, value, null);
    }

    public static PatchOp remove(String path) {
        return of(PatchOpType.REMOVE, path, null, null);
    }

    public static PatchOp replace(String path, JsonNode value) {
        return of(PatchOpType.REPLACE, path, value, null);
    }

    public static PatchOp move(String from, String path) {
        return of(PatchOpType.MOVE, path, null, from);
    }

    public static PatchOp copy(String from, String path) {
        return of(PatchOpType.COPY, path, null, from);
    }

    public static PatchOp test(String path, JsonNode value) {
        return of(PatchOpType.TEST, path, value, null);
    }

    private static PatchOp of(PatchOpType type, String path, JsonNode value, String from) {
        Objects.requireNonNull(type, "type");
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("op", type.wireName());
        node.put("path", path);
        if (type.requiresValue()) {
            node.set("value", value != null ? value : NullNode.getInstance());
        }
        if (type.requiresFrom()) {
            node.put("from", from);
        }
        return new PatchOp(node);
    }

    /** The raw JSON for this operation (defensive copy). */
    @JsonValue
    public JsonNode toJson() {
        return raw.deepCopy();
    }

    public boolean isObject() {
        return raw.isObject();
    }

    /** The {@code op} string, or null when absent or not a string. */
    public String getOp() {
        return textField("op");
    }

    /** Parsed operation kind, or null when {@link #getOp()} is not one of the six canonical kinds. */
    public PatchOpType getType() {
        return PatchOpType.fromWireName(getOp());
    }

    public boolean hasPath() {
        return raw.isObject() && raw.has("path");
    }

    /** The {@code path} pointer, or null when absent or not a string. */
    public String getPath() {
        return textField("path");
    }

    /** True when a {@code value} member is present, even if its value is JSON null. */
    public boolean hasValue() {
        return raw.isObject() && raw.has("value");
    }

    /** The {@code value} member, or null when absent. */
    public JsonNode getValue() {
        return hasValue() ? raw.get("value") : null;
    }

    public boolean hasFrom() {
        return raw.isObject() && raw.has("from");
    }

    /** The {@code from} pointer, or null when absent or not a string. */
    public String getFrom() {
        return textField("from");
    }

    /** Member names other than op/path/value/from, in document order. */
    public List<String> getUnknownFields() {
        if (!raw.isObject()) return List.of();
        List<String> extra = new ArrayList<>();
        Iterator<String> names = raw.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!KNOWN_FIELDS.contains(name)) extra.add(name);
        }
        return Collections.unmodifiableList(extra);
    }

    private String textField(String name) {
        if (!raw.isObject()) return null;
        JsonNode v = raw.get(name);
        return v != null && v.isTextual() ? v.asText() : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PatchOp)) return false;
        return raw.equals(((PatchOp) o).raw);
    }

    @Override
    public int hashCode() {
        return raw.hashCode();
    }

    @Override
    public String toString() {
        return raw.toString();
    }
}
