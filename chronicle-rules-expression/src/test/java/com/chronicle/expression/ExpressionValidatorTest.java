package com.chronicle.expression;

import com.chronicle.model.RulesJson;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExpressionValidatorTest {

    private static JsonNode json(String s) {
        return RulesJson.readTree(s);
    }

    @Test
    void acceptsWellFormedExpression() {
        ExpressionValidationResult r = new ExpressionValidator().validate(
                json("{\"and\": [{\">=\": [{\"var\": \"gold\"}, 10]}, {\"in\": [\"port\", {\"var\": \"tags\"}]}]}"));
        assertTrue(r.valid());
        assertTrue(r.errors().isEmpty());
    }

    @Test
    void rejectsNull() {
        assertFalse(new ExpressionValidator().validate(null).valid());
        assertFalse(new ExpressionValidator().validate(json("null")).valid());
    }

    @Test
    void reportsRepeatedUnknownOperatorOnce() {
        ExpressionValidationResult r = new ExpressionValidator().validate(
                json("{\"or\": [{\"foo\": [1]}, {\"foo\": [2]}, {\"bar\": []}]}"));
        assertFalse(r.valid());
        assertEquals(2, r.errors().size());
        assertTrue(r.errors().get(0).contains("foo"));
        assertTrue(r.errors().get(1).contains("bar"));
    }

    @Test
    void registeredOperatorsAreAccepted() {
        OperatorRegistry registry = OperatorRegistry.empty().register("foo", args -> BooleanNode.TRUE);
        assertTrue(new ExpressionValidator(registry, 10).validate(json("{\"foo\": [1]}")).valid());
    }

    @Test
    void rejectsMultiKeyObjectsAndBadVarPaths() {
        ExpressionValidationResult r = new ExpressionValidator().validate(json("{\"==\": [1, 1], \"!\": [0]}"));
        assertFalse(r.valid());
        assertFalse(new ExpressionValidator().validate(json("{\"var\": [[\"a\"]]}")).valid());
    }

    @Test
    void enforcesMaxDepth() {
        String expr = "true";
        for (int i = 0; i < 6; i++) expr = "{\"!\": [" + expr + "]}";
        assertTrue(new ExpressionValidator(OperatorRegistry.empty(), 6).validate(json(expr)).valid());
        ExpressionValidationResult r = new ExpressionValidator(OperatorRegistry.empty(), 5).validate(json(expr));
        assertFalse(r.valid());
        assertEquals(1, r.errors().size());
    }

    @Test
    void builtInNamesCannotBeRegistered() {
        OperatorRegistry registry = OperatorRegistry.empty();
        assertThrows(IllegalArgumentException.class, () -> registry.register("and", args -> BooleanNode.TRUE));
        assertThrows(IllegalArgumentException.class, () -> registry.register("var", args -> BooleanNode.TRUE));
        registry.register("x", args -> BooleanNode.TRUE);
        assertThrows(IllegalArgumentException.class, () -> registry.register("x", args -> BooleanNode.FALSE));
    }
}
