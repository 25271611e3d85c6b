package com.chronicle.expression;

import com.chronicle.model.JsonValues;
import com.chronicle.model.RulesJson;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CoercionTest {

    private static JsonNode json(String s) {
        return RulesJson.readTree(s);
    }

    @Test
    void falsyValues() {
        for (String v : new String[]{"null", "false", "0", "0.0", "\"\"", "[]"}) {
            assertFalse(Coercion.truthy(json(v)), v);
        }
        for (String v : new String[]{"true", "1", "-1", "\"0\"", "\"false\"", "[0]", "{}"}) {
            assertTrue(Coercion.truthy(json(v)), v);
        }
        assertFalse(Coercion.truthy(null));
    }

    @Test
    void stringFormMatchesJavaScript() {
        assertEquals("a,b", Coercion.toJsString(json("[\"a\", \"b\"]")));
        assertEquals("1,,3", Coercion.toJsString(json("[1, null, 3]")));
        assertEquals("5", Coercion.toJsString(json("5.0")));
        assertEquals("2.5", Coercion.toJsString(json("2.5")));
        assertEquals("[object Object]", Coercion.toJsString(json("{}")));
    }

    @Test
    void looseEqualityCoercesBooleansAndStrings() {
        assertTrue(Coercion.looseEquals(json("true"), json("1")));
        assertTrue(Coercion.looseEquals(json("\"1\""), json("true")));
        assertTrue(Coercion.looseEquals(json("[1]"), json("1")));
        assertTrue(Coercion.looseEquals(json("\"\""), json("0")));
        assertFalse(Coercion.looseEquals(json("null"), json("false")));
        assertFalse(Coercion.looseEquals(json("{}"), json("[]")));
        assertTrue(Coercion.looseEquals(json("[1, 2]"), json("[1, 2.0]")));
    }

    @Test
    void compareReturnsNullForNaN() {
        assertNull(Coercion.compare(json("\"abc\""), json("1")));
        assertEquals(-1, Coercion.compare(json("\"10\""), json("\"9\"")));
        assertEquals(1, Coercion.compare(json("\"10\""), json("9")));
        assertEquals(0, Coercion.compare(json("null"), json("0")));
    }

    @Test
    void requireNumberAcceptsNumericStringsOnly() {
        assertEquals(4.5, Coercion.requireNumber("+", json("\"4.5\"")));
        assertThrows(TypeMismatchException.class, () -> Coercion.requireNumber("+", json("\" \"")));
        assertThrows(TypeMismatchException.class, () -> Coercion.requireNumber("+", json("true")));
        assertThrows(TypeMismatchException.class, () -> Coercion.requireNumber("+", null));
    }

    @Test
    void numberNodePrefersIntegralNodes() {
        assertTrue(Coercion.numberNode(3.0).isInt());
        assertTrue(Coercion.numberNode(3.0e12).isLong());
        assertTrue(Coercion.numberNode(0.5).isDouble());
    }

    @Test
    void nonFiniteNumbersCompareWithoutDecimalConversion() {
        JsonNode infinity = Coercion.numberNode(Double.POSITIVE_INFINITY);
        JsonNode nan = Coercion.numberNode(Double.NaN);

        assertFalse(Coercion.strictEquals(json("[1]"), Coercion.numberNode(1.0)));
        assertFalse(JsonValues.deepEquals(json("[1.5]"), arrayOf(infinity)));
        assertTrue(JsonValues.deepEquals(arrayOf(infinity), arrayOf(Coercion.numberNode(Double.POSITIVE_INFINITY))));
        assertFalse(JsonValues.deepEquals(arrayOf(nan), arrayOf(nan)));
        assertTrue(Coercion.looseEquals(json("[2.5]"), json("2.5")));
    }

    @Test
    void onlyJavaScriptNumericStringsCoerce() {
        assertTrue(Double.isNaN(Coercion.toNumber(json("\"1d\""))));
        assertTrue(Double.isNaN(Coercion.toNumber(json("\"2f\""))));
        assertTrue(Double.isNaN(Coercion.toNumber(json("\"0x1p3\""))));
        assertTrue(Double.isNaN(Coercion.toNumber(json("\"NaN\""))));
        assertThrows(TypeMismatchException.class, () -> Coercion.requireNumber("+", json("\"1d\"")));

        assertEquals(16.0, Coercion.toNumber(json("\"0x10\"")));
        assertEquals(5.0, Coercion.toNumber(json("\"0b101\"")));
        assertEquals(0.5, Coercion.toNumber(json("\" .5 \"")));
        assertEquals(1500.0, Coercion.toNumber(json("\"1.5e3\"")));
        assertEquals(Double.NEGATIVE_INFINITY, Coercion.toNumber(json("\"-Infinity\"")));
    }

    private static JsonNode arrayOf(JsonNode element) {
        return RulesJson.mapper().createArrayNode().add(element);
    }
}
