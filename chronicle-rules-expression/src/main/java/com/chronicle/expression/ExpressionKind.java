package com.chronicle.expression;

/** Shape of an expression node. */
public enum ExpressionKind {
    LITERAL,
    VAR,
    OPERATION
}
