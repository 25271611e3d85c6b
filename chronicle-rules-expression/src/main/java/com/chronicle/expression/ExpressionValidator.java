package com.chronicle.expression;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Validates the wire form of an expression before it is stored or evaluated: rejects null expressions,
 * objects that do not have exactly one key, malformed var references, operators that are neither built in
 * nor registered, and nesting deeper than {@code maxDepth}. All errors are collected; each distinct
 * message is reported once.
 */
public final class ExpressionValidator {

    public static final int DEFAULT_MAX_DEPTH = 32;

    private final OperatorRegistry registry;
    private final int maxDepth;

    public ExpressionValidator() {
        this(OperatorRegistry.empty(), DEFAULT_MAX_DEPTH);
    }

    public ExpressionValidator(OperatorRegistry registry, int maxDepth) {
        this.registry = Objects.requireNonNull(registry, "registry");
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be >= 1");
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public ExpressionValidationResult validate(JsonNode expression) {
        if (expression == null || expression.isNull() || expression.isMissingNode()) {
            return ExpressionValidationResult.of(List.of("Expression cannot be null"));
        }
        Set<String> errors = new LinkedHashSet<>();
        walk(expression, 0, errors);
        return ExpressionValidationResult.of(List.copyOf(errors));
    }

    private void walk(JsonNode node, int depth, Set<String> errors) {
        if (depth > maxDepth) {
            errors.add("Expression exceeds maximum depth of " + maxDepth);
            return;
        }
        if (node.isArray()) {
            for (JsonNode element : node) walk(element, depth + 1, errors);
            return;
        }
        if (!node.isObject()) return;
        if (node.size() != 1) {
            errors.add("Expression object must have exactly one operator key, found " + node.size());
            Iterator<JsonNode> values = node.elements();
            while (values.hasNext()) walk(values.next(), depth + 1, errors);
            return;
        }
        Map.Entry<String, JsonNode> entry = node.fields().next();
        String name = entry.getKey();
        JsonNode args = entry.getValue();
        if (Operator.VAR.equals(name)) {
            JsonNode path = args.isArray() ? args.path(0) : args;
            if (path.isContainerNode() || path.isBoolean()) {
                errors.add("var path must be a string or number");
            }
            if (args.isArray() && args.size() > 1) walk(args.get(1), depth + 1, errors);
            return;
        }
        if (Operator.fromSymbol(name) == null && !registry.contains(name)) {
            errors.add("Unknown operator: " + name);
        }
        if (args.isArray()) {
            for (JsonNode a : args) walk(a, depth + 1, errors);
        } else {
            walk(args, depth + 1, errors);
        }
    }
}
