package com.chronicle.expression;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Objects;

/**
 * Operator application {@code {"name": [args...]}}. {@code operator} is the built-in operator for
 * {@code name}, or null when the name is not built in (a custom operator or an unknown one).
 * Unknown names are only an error when the node is evaluated.
 */
public record Operation(String name, List<Expression> args, Operator operator) implements Expression {

    public Operation {
        Objects.requireNonNull(name, "name");
        args = args != null ? List.copyOf(args) : List.of();
    }

    public static Operation of(String name, List<Expression> args) {
        return new Operation(name, args, Operator.fromSymbol(name));
    }

    public boolean isBuiltIn() {
        return operator != null;
    }

    public Expression arg(int index) {
        return index < args.size() ? args.get(index) : null;
    }

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.OPERATION;
    }

    @Override
    public JsonNode toJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        ArrayNode arr = node.putArray(name);
        for (Expression a : args) arr.add(a.toJson());
        return node;
    }
}
