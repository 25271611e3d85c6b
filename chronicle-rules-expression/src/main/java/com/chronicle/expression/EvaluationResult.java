package com.chronicle.expression;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.List;

/**
 * Outcome of evaluating one expression: {@code {success, value, trace}} plus the error when evaluation failed.
 * A failed result has a JSON null value and is never truthy.
 */
public record EvaluationResult(boolean success, JsonNode value, List<TraceStep> trace, String error, String errorType) {

    public EvaluationResult {
        value = value != null ? value : NullNode.getInstance();
        trace = trace != null ? List.copyOf(trace) : List.of();
    }

    public static EvaluationResult success(JsonNode value, List<TraceStep> trace) {
        return new EvaluationResult(true, value, trace, null, null);
    }

    public static EvaluationResult failure(ExpressionException e, List<TraceStep> trace) {
        return new EvaluationResult(false, null, trace, e.getMessage(), e.getErrorType());
    }

    public static EvaluationResult failure(String errorType, String message) {
        return new EvaluationResult(false, null, List.of(), message, errorType);
    }

    /** True only for a successful evaluation whose value is truthy. */
    public boolean isTruthy() {
        return success && Coercion.truthy(value);
    }

    public EvaluationResult withoutTrace() {
        return trace.isEmpty() ? this : new EvaluationResult(success, value, List.of(), error, errorType);
    }
}
