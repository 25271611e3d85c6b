package com.chronicle.expression;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One visited node: {@code operation} is the operator symbol, {@code "var"} or {@code "literal"};
 * {@code input} is the node's wire form (the path for a var); {@code output} is what it evaluated to,
 * or null when evaluation failed inside the node.
 */
public record TraceStep(int step, String operation, JsonNode input, JsonNode output) {
}
