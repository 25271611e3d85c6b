/**
 * Condition expression language: a JSON-logic dialect over entity variables.
 *
 * <ul>
 *   <li>{@link com.chronicle.expression.ExpressionParser} turns the JSON wire form into an
 *       {@link com.chronicle.expression.Expression} tree (literal, var reference or operation)</li>
 *   <li>{@link com.chronicle.expression.ExpressionEvaluator} evaluates a tree against a context and records an
 *       {@link com.chronicle.expression.ExecutionTrace}</li>
 *   <li>{@link com.chronicle.expression.ExpressionValidator} checks shape, depth and operator names up front</li>
 *   <li>{@link com.chronicle.expression.OperatorRegistry} holds campaign-specific
 *       {@link com.chronicle.expression.CustomOperator}s</li>
 * </ul>
 */
package com.chronicle.expression;
