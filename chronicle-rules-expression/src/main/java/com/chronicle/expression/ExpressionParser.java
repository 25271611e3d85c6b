package com.chronicle.expression;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Parses the JSON wire form of an expression into an immutable {@link Expression} tree.
 * <ul>
 *   <li>scalars become {@link Literal}s; arrays become array literals whose elements are parsed recursively</li>
 *   <li>{@code {"var": path}} and {@code {"var": [path, default]}} become {@link VarRef}s</li>
 *   <li>any other single-key object becomes an {@link Operation}; a non-array argument is a single argument</li>
 * </ul>
 * Operator names are not checked here so that an unknown operator in a branch that is never taken does not fail.
 */
public final class ExpressionParser {

    private ExpressionParser() {
    }

    /**
     * @throws MalformedExpressionException when an object does not have exactly one key or a var path is not a string
     */
    public static Expression parse(JsonNode node) {
        if (node == null || node.isMissingNode()) {
            return Literal.scalar(NullNode.getInstance());
        }
        if (node.isArray()) {
            List<Expression> elements = new ArrayList<>(node.size());
            for (JsonNode element : node) elements.add(parse(element));
            return Literal.array(elements);
        }
        if (!node.isObject()) {
            return Literal.scalar(node);
        }
        if (node.size() != 1) {
            throw new MalformedExpressionException(
                    "expression object must have exactly one operator key, found " + node.size());
        }
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        Map.Entry<String, JsonNode> entry = it.next();
        String name = entry.getKey();
        JsonNode rawArgs = entry.getValue();
        if (Operator.VAR.equals(name)) {
            return parseVar(rawArgs);
        }
        List<Expression> args = new ArrayList<>();
        if (rawArgs.isArray()) {
            for (JsonNode a : rawArgs) args.add(parse(a));
        } else {
            args.add(parse(rawArgs));
        }
        return Operation.of(name, args);
    }

    private static VarRef parseVar(JsonNode rawArgs) {
        JsonNode pathNode = rawArgs;
        Expression defaultValue = null;
        if (rawArgs.isArray()) {
            pathNode = rawArgs.size() > 0 ? rawArgs.get(0) : NullNode.getInstance();
            if (rawArgs.size() > 1) defaultValue = parse(rawArgs.get(1));
        }
        return new VarRef(pathText(pathNode), defaultValue);
    }

    private static String pathText(JsonNode pathNode) {
        if (pathNode == null || pathNode.isNull()) return "";
        if (pathNode.isTextual()) return pathNode.asText();
        if (pathNode.isNumber()) return pathNode.asText();
        throw new MalformedExpressionException("var path must be a string or number, got " + pathNode.getNodeType());
    }
}
