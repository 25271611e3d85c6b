package com.chronicle.expression;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * Variable reference {@code {"var": "a.b.c"}} or {@code {"var": ["a.b.c", default]}}.
 * An empty path is "no reference". {@code defaultValue} is null when no default was given.
 */
public record VarRef(String path, Expression defaultValue) implements Expression {

    public VarRef {
        Objects.requireNonNull(path, "path");
    }

    public static VarRef of(String path) {
        return new VarRef(path, null);
    }

    /** Root segment of the path ({@code settlement} for {@code settlement.population}); empty for an empty path. */
    public String baseName() {
        int dot = path.indexOf('.');
        return dot < 0 ? path : path.substring(0, dot);
    }

    public boolean isEmpty() {
        return path.isEmpty();
    }

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.VAR;
    }

    @Override
    public JsonNode toJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        if (defaultValue == null) {
            node.put("var", path);
        } else {
            ArrayNode args = node.putArray("var");
            args.add(path);
            args.add(defaultValue.toJson());
        }
        return node;
    }
}
