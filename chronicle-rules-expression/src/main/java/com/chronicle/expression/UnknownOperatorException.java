package com.chronicle.expression;

/**
 * Thrown when an operation names neither a built-in nor a registered custom operator.
 */
public final class UnknownOperatorException extends ExpressionException {

    private final String operatorName;

    public UnknownOperatorException(String operatorName) {
        super(String.format("Unknown operator: %s", operatorName));
        this.operatorName = operatorName;
    }

    public String getOperatorName() {
        return operatorName;
    }

    @Override
    public String getErrorType() {
        return "UnknownOperator";
    }
}
