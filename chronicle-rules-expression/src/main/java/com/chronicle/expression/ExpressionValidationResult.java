package com.chronicle.expression;

import java.util.List;

/**
 * Structural check of an expression without evaluating it.
 */
public record ExpressionValidationResult(boolean valid, List<String> errors) {

    public ExpressionValidationResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public static ExpressionValidationResult ok() {
        return new ExpressionValidationResult(true, List.of());
    }

    public static ExpressionValidationResult of(List<String> errors) {
        return new ExpressionValidationResult(errors == null || errors.isEmpty(), errors);
    }
}
