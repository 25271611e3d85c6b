package com.chronicle.expression;

import com.chronicle.model.RulesJson;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExpressionEvaluatorTest {

    private final ExpressionEvaluator evaluator = new ExpressionEvaluator();

    private static JsonNode json(String s) {
        return RulesJson.readTree(s);
    }

    private JsonNode eval(String expression, String context) {
        EvaluationResult result = evaluator.evaluate(json(expression), json(context));
        assertTrue(result.success(), () -> "expected success but got " + result.error());
        return result.value();
    }

    private EvaluationResult evalResult(String expression, String context) {
        return evaluator.evaluate(json(expression), json(context));
    }

    @Test
    void literalsEvaluateToThemselves() {
        assertEquals(json("5"), eval("5", "{}"));
        assertEquals(json("\"a\""), eval("\"a\"", "{}"));
        assertEquals(json("[1,2]"), eval("[1,2]", "{}"));
        assertTrue(eval("null", "{}").isNull());
    }

    @Test
    void varResolvesDottedPath() {
        assertEquals(1200, eval("{\"var\": \"settlement.population\"}",
                "{\"settlement\": {\"population\": 1200}}").asInt());
        assertEquals("b", eval("{\"var\": \"list.1\"}", "{\"list\": [\"a\", \"b\"]}").asText());
    }

    @Test
    void missingVarReturnsDefaultOrNullWithoutThrowing() {
        assertTrue(eval("{\"var\": \"foo\"}", "{}").isNull());
        assertEquals(7, eval("{\"var\": [\"settlement.missing\", 7]}", "{\"settlement\": {}}").asInt());
        assertEquals(3, eval("{\"var\": [\"x\", 3]}", "{\"x\": null}").asInt());
    }

    @Test
    void emptyVarNameIsNoReference() {
        assertTrue(eval("{\"var\": \"\"}", "{\"a\": 1}").isNull());
    }

    @Test
    void booleanOperatorsReturnDecidingValue() {
        assertEquals(0, eval("{\"and\": [1, 0, 2]}", "{}").asInt());
        assertEquals(2, eval("{\"and\": [1, 2]}", "{}").asInt());
        assertEquals("x", eval("{\"or\": [false, \"\", \"x\"]}", "{}").asText());
        assertTrue(eval("{\"!\": [[]]}", "{}").asBoolean());
        assertFalse(eval("{\"not\": [1]}", "{}").asBoolean());
        assertTrue(eval("{\"!!\": [\"0\"]}", "{}").asBoolean());
    }

    @Test
    void andShortCircuitSkipsUnknownOperatorAndLeavesItOutOfTrace() {
        EvaluationResult result = evalResult("{\"and\": [false, {\"explode\": [1, {\"var\": \"x\"}]}]}", "{}");
        assertTrue(result.success());
        assertFalse(result.value().asBoolean());
        assertEquals(2, result.trace().size());
        assertEquals("and", result.trace().get(0).operation());
        assertEquals("literal", result.trace().get(1).operation());
    }

    @Test
    void orShortCircuitsOnFirstTruthyValue() {
        EvaluationResult result = evalResult("{\"or\": [true, {\"explode\": []}]}", "{}");
        assertTrue(result.success());
        assertEquals(2, result.trace().size());
    }

    @Test
    void ifEvaluatesOnlyTakenBranch() {
        EvaluationResult result = evalResult(
                "{\"if\": [{\"<\": [{\"var\": \"t\"}, 0]}, \"freezing\", {\"<\": [{\"var\": \"t\"}, 30]}, \"mild\", \"hot\"]}",
                "{\"t\": 12}");
        assertEquals("mild", result.value().asText());
        assertTrue(result.trace().stream().noneMatch(s -> "freezing".equals(s.input().asText())));
        assertTrue(result.trace().stream().noneMatch(s -> "hot".equals(s.input().asText())));
        assertEquals("b", eval("{\"?:\": [false, \"a\", \"b\"]}", "{}").asText());
        assertTrue(eval("{\"if\": [false, 1]}", "{}").isNull());
    }

    @Test
    void unknownOperatorIsHardError() {
        EvaluationResult result = evalResult("{\"frobnicate\": [1]}", "{}");
        assertFalse(result.success());
        assertEquals("UnknownOperator", result.errorType());
        assertTrue(result.error().contains("frobnicate"));
        assertFalse(result.isTruthy());
    }

    @Test
    void arraysCompareLooselyAgainstScalarsButNotStrictly() {
        String context = "{\"settlement\": {\"tags\": [\"trade_hub\"]}}";
        assertTrue(eval("{\"==\": [{\"var\": \"settlement.tags\"}, \"trade_hub\"]}", context).asBoolean());
        assertFalse(eval("{\"===\": [{\"var\": \"settlement.tags\"}, \"trade_hub\"]}", context).asBoolean());
        assertFalse(eval("{\"==\": [{\"var\": \"settlement.tags\"}, \"port\"]}", context).asBoolean());
    }

    @Test
    void comparisonOperators() {
        assertTrue(eval("{\"==\": [1, \"1\"]}", "{}").asBoolean());
        assertFalse(eval("{\"===\": [1, \"1\"]}", "{}").asBoolean());
        assertTrue(eval("{\"===\": [1, 1.0]}", "{}").asBoolean());
        assertTrue(eval("{\"!=\": [1, 2]}", "{}").asBoolean());
        assertTrue(eval("{\"!==\": [1, \"1\"]}", "{}").asBoolean());
        assertTrue(eval("{\">\": [{\"var\": \"gold\"}, 100]}", "{\"gold\": 150}").asBoolean());
        assertTrue(eval("{\">=\": [\"b\", \"a\"]}", "{}").asBoolean());
        assertTrue(eval("{\"<\": [1, 5, 10]}", "{}").asBoolean());
        assertFalse(eval("{\"<\": [1, 10, 10]}", "{}").asBoolean());
        assertTrue(eval("{\"<=\": [1, 10, 10]}", "{}").asBoolean());
        assertFalse(eval("{\">\": [\"abc\", 1]}", "{}").asBoolean());
        assertTrue(eval("{\"==\": [null, null]}", "{}").asBoolean());
        assertFalse(eval("{\"==\": [null, 0]}", "{}").asBoolean());
    }

    @Test
    void arithmetic() {
        assertEquals(6, eval("{\"+\": [1, 2, 3]}", "{}").asInt());
        assertEquals(5, eval("{\"+\": [\"2\", 3]}", "{}").asInt());
        assertEquals(-4, eval("{\"-\": [4]}", "{}").asInt());
        assertEquals(1, eval("{\"-\": [4, 3]}", "{}").asInt());
        assertEquals(24, eval("{\"*\": [2, 3, 4]}", "{}").asInt());
        assertEquals(2.5, eval("{\"/\": [5, 2]}", "{}").asDouble());
        assertEquals(1, eval("{\"%\": [7, 3]}", "{}").asInt());
        assertEquals(1, eval("{\"min\": [3, 1, 2]}", "{}").asInt());
        assertEquals(3, eval("{\"max\": [3, 1, 2]}", "{}").asInt());
        assertTrue(eval("{\"max\": []}", "{}").isNull());
    }

    @Test
    void arithmeticOnNonNumericIsTypeMismatch() {
        EvaluationResult result = evalResult("{\"+\": [1, \"abc\"]}", "{}");
        assertFalse(result.success());
        assertEquals("TypeMismatch", result.errorType());
        assertEquals("TypeMismatch", evalResult("{\"*\": [2, [1]]}", "{}").errorType());
        assertEquals("TypeMismatch", evalResult("{\"/\": [1, 0]}", "{}").errorType());
        assertEquals("TypeMismatch", evalResult("{\"%\": [1, 0]}", "{}").errorType());
        assertEquals("TypeMismatch", evalResult("{\"+\": [null, 1]}", "{}").errorType());
    }

    @Test
    void wrongArityIsMalformed() {
        assertEquals("MalformedExpression", evalResult("{\"==\": [1]}", "{}").errorType());
        assertEquals("MalformedExpression", evalResult("{\"/\": [1, 2, 3]}", "{}").errorType());
        assertEquals("MalformedExpression", evalResult("{\"and\": []}", "{}").errorType());
        assertEquals("MalformedExpression", evalResult("{\"a\": 1, \"b\": 2}", "{}").errorType());
    }

    @Test
    void membershipAndStrings() {
        assertTrue(eval("{\"in\": [\"trade_hub\", {\"var\": \"tags\"}]}", "{\"tags\": [\"port\", \"trade_hub\"]}").asBoolean());
        assertTrue(eval("{\"in\": [\"Spring\", \"Springfield\"]}", "{}").asBoolean());
        assertFalse(eval("{\"in\": [\"x\", 5]}", "{}").asBoolean());
        assertEquals("I love apple pie", eval("{\"cat\": [\"I love \", \"apple\", \" pie\"]}", "{}").asText());
        assertEquals("n=3", eval("{\"cat\": [\"n=\", 3]}", "{}").asText());
        assertEquals("field", eval("{\"substr\": [\"Springfield\", 6]}", "{}").asText());
        assertEquals("eld", eval("{\"substr\": [\"Springfield\", -3]}", "{}").asText());
        assertEquals("Spring", eval("{\"substr\": [\"Springfield\", 0, -5]}", "{}").asText());
        assertEquals("ring", eval("{\"substr\": [\"Springfield\", 2, 4]}", "{}").asText());
    }

    @Test
    void collectionOperators() {
        String ctx = "{\"levels\": [1, 2, 3, 4]}";
        assertEquals(json("[2,4,6,8]"), eval("{\"map\": [{\"var\": \"levels\"}, {\"*\": [{\"var\": \"\"}, 2]}]}", ctx));
        assertEquals(json("[3,4]"), eval("{\"filter\": [{\"var\": \"levels\"}, {\">\": [{\"var\": \"\"}, 2]}]}", ctx));
        assertEquals(10, eval("{\"reduce\": [{\"var\": \"levels\"}, {\"+\": [{\"var\": \"current\"}, {\"var\": \"accumulator\"}]}, 0]}", ctx).asInt());
        assertTrue(eval("{\"all\": [{\"var\": \"levels\"}, {\">\": [{\"var\": \"\"}, 0]}]}", ctx).asBoolean());
        assertFalse(eval("{\"all\": [[], true]}", "{}").asBoolean());
        assertTrue(eval("{\"none\": [{\"var\": \"levels\"}, {\">\": [{\"var\": \"\"}, 9]}]}", ctx).asBoolean());
        assertTrue(eval("{\"some\": [{\"var\": \"levels\"}, {\"==\": [{\"var\": \"\"}, 3]}]}", ctx).asBoolean());
        assertEquals(json("[1,2,3,4]"), eval("{\"merge\": [[1, 2], 3, [4]]}", "{}"));
        assertEquals(json("[]"), eval("{\"map\": [{\"var\": \"nope\"}, 1]}", "{}"));
    }

    @Test
    void missingReportsAbsentVariables() {
        assertEquals(json("[\"b\"]"), eval("{\"missing\": [\"a\", \"b\"]}", "{\"a\": 1}"));
        assertEquals(json("[\"b\"]"), eval("{\"missing\": [[\"a\", \"b\"]]}", "{\"a\": 1, \"b\": \"\"}"));
        assertEquals(json("[]"), eval("{\"missing_some\": [1, [\"a\", \"b\"]]}", "{\"a\": 1}"));
        assertEquals(json("[\"a\", \"b\"]"), eval("{\"missing_some\": [1, [\"a\", \"b\"]]}", "{}"));
    }

    @Test
    void traceRecordsOneStepPerVisitedNodeInPreOrder() {
        EvaluationResult result = evalResult("{\">\": [{\"var\": \"gold\"}, 10]}", "{\"gold\": 20}");
        List<TraceStep> trace = result.trace();
        assertEquals(3, trace.size());
        assertEquals(">", trace.get(0).operation());
        assertTrue(trace.get(0).output().asBoolean());
        assertEquals("var", trace.get(1).operation());
        assertEquals(TextNode.valueOf("gold"), trace.get(1).input());
        assertEquals(20, trace.get(1).output().asInt());
        assertEquals(10, trace.get(2).output().asInt());
        assertEquals(1, trace.get(0).step());
        assertEquals(3, trace.get(2).step());
    }

    @Test
    void failedEvaluationKeepsPartialTrace() {
        EvaluationResult result = evalResult("{\"+\": [{\"var\": \"a\"}, \"x\"]}", "{\"a\": 1}");
        assertFalse(result.success());
        assertEquals(3, result.trace().size());
        assertNull(result.trace().get(0).output());
    }

    @Test
    void traceCanBeDisabled() {
        Expression expr = ExpressionParser.parse(json("{\"==\": [1, 1]}"));
        EvaluationResult result = evaluator.evaluate(expr, json("{}"), false);
        assertTrue(result.isTruthy());
        assertTrue(result.trace().isEmpty());
    }

    @Test
    void customOperatorIsConsultedAfterBuiltIns() {
        OperatorRegistry registry = OperatorRegistry.empty()
                .register("daysSince", args -> Coercion.numberNode(100 - args.get(0).asDouble()));
        ExpressionEvaluator custom = new ExpressionEvaluator(registry);
        EvaluationResult result = custom.evaluate(json("{\">\": [{\"daysSince\": [{\"var\": \"founded\"}]}, 30]}"),
                json("{\"founded\": 40}"));
        assertTrue(result.isTruthy());
    }

    @Test
    void customOperatorFailureBecomesExpressionError() {
        OperatorRegistry registry = OperatorRegistry.empty()
                .register("boom", args -> {
                    throw new IllegalStateException("bad input");
                });
        EvaluationResult result = new ExpressionEvaluator(registry).evaluate(json("{\"boom\": []}"), json("{}"));
        assertFalse(result.success());
        assertTrue(result.error().contains("bad input"));
    }

    @Test
    void evaluateWithTraceThrowsForCallersThatWantExceptions() {
        Expression expr = ExpressionParser.parse(json("{\"nope\": []}"));
        UnknownOperatorException e = assertThrows(UnknownOperatorException.class,
                () -> evaluator.evaluate(expr, json("{}"), new ExecutionTrace()));
        assertEquals("nope", e.getOperatorName());
    }

    @Test
    void overflowingArithmeticComparesAsInfinity() {
        EvaluationResult result = evalResult("{\"===\": [[{\"*\": [1e308, 10]}], [1]]}", "{}");
        assertTrue(result.success());
        assertFalse(result.value().asBoolean());

        assertTrue(eval("{\"==\": [{\"*\": [1e308, 10]}, {\"+\": [\"Infinity\"]}]}", "{}").asBoolean());
        assertFalse(eval("{\"==\": [{\"-\": [\"Infinity\", \"Infinity\"]}, 0]}", "{}").asBoolean());
    }

    @Test
    void javaOnlyNumericSuffixIsRejected() {
        EvaluationResult result = evalResult("{\"+\": [\"1d\", 1]}", "{}");
        assertFalse(result.success());
        assertEquals("TypeMismatch", result.errorType());
    }
}
