package com.chronicle.expression;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Immutable node of a parsed condition expression: a {@link Literal}, a {@link VarRef} or an {@link Operation}.
 * Dispatch on {@link #kind()}; the three implementations are the only ones.
 */
public interface Expression {

    ExpressionKind kind();

    /** Wire form of this node, equal in meaning to the JSON it was parsed from. */
    JsonNode toJson();
}
