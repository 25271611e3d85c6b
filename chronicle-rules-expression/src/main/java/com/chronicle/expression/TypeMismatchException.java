package com.chronicle.expression;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Thrown when an operator receives an operand it cannot coerce, e.g. arithmetic on a non-numeric string
 * or division by zero.
 */
public final class TypeMismatchException extends ExpressionException {

    private final String operatorName;
    private final String offendingValue;

    public TypeMismatchException(String operatorName, JsonNode offendingValue, String reason) {
        super(String.format("Type mismatch in '%s': %s (value=%s)", operatorName, reason, offendingValue));
        this.operatorName = operatorName;
        this.offendingValue = offendingValue != null ? offendingValue.toString() : "null";
    }

    public String getOperatorName() {
        return operatorName;
    }

    /** JSON text of the operand that could not be coerced. */
    public String getOffendingValue() {
        return offendingValue;
    }

    @Override
    public String getErrorType() {
        return "TypeMismatch";
    }
}
