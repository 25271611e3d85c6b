package com.chronicle.expression;

/**
 * Thrown when an expression has the wrong shape (an object with several keys, a non-string variable path)
 * or an operator gets the wrong number of arguments.
 */
public final class MalformedExpressionException extends ExpressionException {

    private final String reason;

    public MalformedExpressionException(String reason) {
        super("Malformed expression: " + reason);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String getErrorType() {
        return "MalformedExpression";
    }
}
