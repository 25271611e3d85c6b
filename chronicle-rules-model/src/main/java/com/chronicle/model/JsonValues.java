package com.chronicle.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Iterator;
import java.util.Map;

/**
 * JSON value helpers shared by the evaluator and the patch engine.
 */
public final class JsonValues {

    private JsonValues() {
    }

    /**
     * Structural equality where numbers compare by numeric value ({@code 1} equals {@code 1.0}).
     * A Java null and a JSON null are equal; object member order is ignored.
     */
    public static boolean deepEquals(JsonNode a, JsonNode b) {
        boolean aNull = a == null || a.isNull() || a.isMissingNode();
        boolean bNull = b == null || b.isNull() || b.isMissingNode();
        if (aNull || bNull) return aNull && bNull;
        if (a.isNumber() && b.isNumber()) {
            if (a.isIntegralNumber() && b.isIntegralNumber()) {
                return a.bigIntegerValue().equals(b.bigIntegerValue());
            }
            if (!isFinite(a) || !isFinite(b)) {
                return a.doubleValue() == b.doubleValue();
            }
            return a.decimalValue().compareTo(b.decimalValue()) == 0;
        }
        if (a.getNodeType() != b.getNodeType()) return false;
        if (a.isArray()) {
            if (a.size() != b.size()) return false;
            for (int i = 0; i < a.size(); i++) {
                if (!deepEquals(a.get(i), b.get(i))) return false;
            }
            return true;
        }
        if (a.isObject()) {
            if (a.size() != b.size()) return false;
            Iterator<Map.Entry<String, JsonNode>> it = a.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                JsonNode other = b.get(e.getKey());
                if (other == null || !deepEquals(e.getValue(), other)) return false;
            }
            return true;
        }
        return a.equals(b);
    }

    /** False for infinite or NaN floating-point nodes, which have no decimal form. */
    public static boolean isFinite(JsonNode number) {
        if (number.isDouble() || number.isFloat()) return Double.isFinite(number.doubleValue());
        return true;
    }
}
