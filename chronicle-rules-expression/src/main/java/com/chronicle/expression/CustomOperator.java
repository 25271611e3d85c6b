package com.chronicle.expression;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Campaign-specific operator registered in an {@link OperatorRegistry}. Arguments are evaluated
 * eagerly, left to right, before {@link #apply} is called. Implementations must be pure.
 */
@FunctionalInterface
public interface CustomOperator {

    /**
     * @param args evaluated arguments (never null; elements may be JSON null)
     * @return the result value (null is treated as JSON null)
     * @throws ExpressionException to report an invalid argument
     */
    JsonNode apply(List<JsonNode> args);
}
