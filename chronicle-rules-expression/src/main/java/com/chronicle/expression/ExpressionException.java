package com.chronicle.expression;

/**
 * Base class of expression parse and evaluation failures. Evaluation boundaries turn these into a failed
 * {@link EvaluationResult}; a condition that fails to evaluate is treated as not matching.
 */
public class ExpressionException extends RuntimeException {

    public ExpressionException(String message) {
        super(message);
    }

    public ExpressionException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Short error category for results and logs, e.g. {@code UnknownOperator}. */
    public String getErrorType() {
        return "Expression";
    }
}
