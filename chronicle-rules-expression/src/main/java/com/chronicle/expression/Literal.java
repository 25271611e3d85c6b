package com.chronicle.expression;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.List;

/**
 * A scalar value (string, number, boolean, null) or an array whose elements are themselves expressions.
 * For scalars {@code value} holds the value and {@code elements} is empty; for arrays {@code value} is null
 * (an empty array literal has no elements).
 */
public record Literal(JsonNode value, List<Expression> elements) implements Expression {

    public Literal {
        elements = elements != null ? List.copyOf(elements) : List.of();
        if (value != null && !elements.isEmpty()) {
            throw new IllegalArgumentException("A literal is either a scalar or an array");
        }
    }

    public static Literal scalar(JsonNode value) {
        return new Literal(value != null ? value : NullNode.getInstance(), List.of());
    }

    public static Literal array(List<Expression> elements) {
        return new Literal(null, elements);
    }

    public boolean isArray() {
        return value == null;
    }

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.LITERAL;
    }

    @Override
    public JsonNode toJson() {
        if (!isArray()) return value;
        ArrayNode arr = JsonNodeFactory.instance.arrayNode();
        for (Expression e : elements) arr.add(e.toJson());
        return arr;
    }
}
