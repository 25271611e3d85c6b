package com.chronicle.expression;

import com.chronicle.model.JsonValues;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.regex.Pattern;

/**
 * JSON-logic coercion rules (JavaScript semantics) over Jackson values.
 * <p>
 * Falsy values: {@code null}, {@code false}, {@code 0}, {@code NaN}, {@code ""} and the empty array.
 * Loose equality follows JavaScript {@code ==}: an array compared with a scalar is compared through its
 * string form, so {@code ["a"] == "a"} holds. Strict equality requires the same JSON type
 * (numbers compare by value, arrays and objects structurally).
 */
public final class Coercion {

    /** Decimal literals accepted by JavaScript {@code Number(string)}. */
    private static final Pattern JS_DECIMAL = Pattern.compile("[+-]?(Infinity|(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?)");
    private static final Pattern JS_RADIX_INTEGER = Pattern.compile("0([xX][0-9a-fA-F]+|[oO][0-7]+|[bB][01]+)");

    private Coercion() {
    }

    public static boolean isNull(JsonNode v) {
        return v == null || v.isNull() || v.isMissingNode();
    }

    public static boolean truthy(JsonNode v) {
        if (isNull(v)) return false;
        if (v.isBoolean()) return v.booleanValue();
        if (v.isNumber()) {
            double d = v.doubleValue();
            return d != 0 && !Double.isNaN(d);
        }
        if (v.isTextual()) return !v.textValue().isEmpty();
        if (v.isArray()) return v.size() > 0;
        return true;
    }

    /** JavaScript {@code Number(v)}; NaN when not convertible. */
    public static double toNumber(JsonNode v) {
        if (isNull(v)) return 0;
        if (v.isNumber()) return v.doubleValue();
        if (v.isBoolean()) return v.booleanValue() ? 1 : 0;
        if (v.isTextual()) return parseNumber(v.textValue());
        if (v.isArray()) return parseNumber(toJsString(v));
        return Double.NaN;
    }

    /**
     * Strict numeric operand for arithmetic: numbers and numeric strings only.
     *
     * @throws TypeMismatchException for anything else
     */
    public static double requireNumber(String operator, JsonNode v) {
        if (v != null && v.isNumber()) return v.doubleValue();
        if (v != null && v.isTextual()) {
            double d = parseNumber(v.textValue());
            if (!Double.isNaN(d) && !v.textValue().isBlank()) return d;
        }
        throw new TypeMismatchException(operator, v, "operand is not numeric");
    }

    private static double parseNumber(String s) {
        String t = s.trim();
        if (t.isEmpty()) return 0;
        if (JS_DECIMAL.matcher(t).matches()) {
            return Double.parseDouble(t);
        }
        if (JS_RADIX_INTEGER.matcher(t).matches()) {
            char prefix = Character.toLowerCase(t.charAt(1));
            int radix = prefix == 'x' ? 16 : prefix == 'o' ? 8 : 2;
            return new BigInteger(t.substring(2), radix).doubleValue();
        }
        return Double.NaN;
    }

    /** JavaScript {@code String(v)}; array elements joined by commas with null elements as empty strings. */
    public static String toJsString(JsonNode v) {
        if (isNull(v)) return "null";
        if (v.isTextual()) return v.textValue();
        if (v.isBoolean()) return Boolean.toString(v.booleanValue());
        if (v.isNumber()) return formatNumber(v.doubleValue());
        if (v.isArray()) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < v.size(); i++) {
                if (i > 0) sb.append(',');
                JsonNode e = v.get(i);
                if (!isNull(e)) sb.append(toJsString(e));
            }
            return sb.toString();
        }
        return "[object Object]";
    }

    static String formatNumber(double d) {
        if (Double.isNaN(d)) return "NaN";
        if (Double.isInfinite(d)) return d > 0 ? "Infinity" : "-Infinity";
        if (d == Math.rint(d) && Math.abs(d) < 1e21) {
            return new BigDecimal(d).toPlainString();
        }
        return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }

    /** Number node: integral values become int or long nodes, everything else a double node. */
    public static JsonNode numberNode(double d) {
        if (d == Math.rint(d) && !Double.isInfinite(d)) {
            if (d >= Integer.MIN_VALUE && d <= Integer.MAX_VALUE) return IntNode.valueOf((int) d);
            if (d >= Long.MIN_VALUE && d <= Long.MAX_VALUE) return LongNode.valueOf((long) d);
        }
        return DoubleNode.valueOf(d);
    }

    public static JsonNode bool(boolean b) {
        return BooleanNode.valueOf(b);
    }

    public static JsonNode nullNode() {
        return NullNode.getInstance();
    }

    public static boolean strictEquals(JsonNode a, JsonNode b) {
        if (isNull(a) || isNull(b)) return isNull(a) && isNull(b);
        if (a.isNumber() && b.isNumber()) return a.doubleValue() == b.doubleValue();
        if (a.getNodeType() != b.getNodeType()) return false;
        return JsonValues.deepEquals(a, b);
    }

    /** JavaScript abstract equality over JSON values. */
    public static boolean looseEquals(JsonNode a, JsonNode b) {
        if (isNull(a) || isNull(b)) return isNull(a) && isNull(b);
        if (a.getNodeType() == b.getNodeType() || (a.isNumber() && b.isNumber())) {
            return strictEquals(a, b);
        }
        if (a.isBoolean()) return looseEquals(numberNode(toNumber(a)), b);
        if (b.isBoolean()) return looseEquals(a, numberNode(toNumber(b)));
        if (a.isNumber() && b.isTextual()) return a.doubleValue() == toNumber(b);
        if (a.isTextual() && b.isNumber()) return toNumber(a) == b.doubleValue();
        if (a.isContainerNode() && !b.isContainerNode()) {
            return looseEquals(TextNode.valueOf(toJsString(a)), b);
        }
        if (!a.isContainerNode() && b.isContainerNode()) {
            return looseEquals(a, TextNode.valueOf(toJsString(b)));
        }
        return false;
    }

    /**
     * JavaScript relational comparison: two strings compare lexicographically, anything else numerically.
     * Returns null when the comparison is undefined (a NaN operand), which every relational operator treats as false.
     */
    public static Integer compare(JsonNode a, JsonNode b) {
        JsonNode pa = toPrimitive(a);
        JsonNode pb = toPrimitive(b);
        if (pa.isTextual() && pb.isTextual()) {
            return Integer.signum(pa.textValue().compareTo(pb.textValue()));
        }
        double x = toNumber(pa);
        double y = toNumber(pb);
        if (Double.isNaN(x) || Double.isNaN(y)) return null;
        return Double.compare(x, y) == 0 || x == y ? 0 : (x < y ? -1 : 1);
    }

    private static JsonNode toPrimitive(JsonNode v) {
        if (isNull(v)) return NullNode.getInstance();
        if (v.isContainerNode()) return TextNode.valueOf(toJsString(v));
        return v;
    }
}
