package com.chronicle.expression;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Built-in operators. Some operators answer to more than one symbol ({@code !} and {@code not},
 * {@code if} and {@code ?:}). Lazy operators decide themselves which arguments to evaluate.
 */
public enum Operator {
    AND(true, "and"),
    OR(true, "or"),
    NOT(false, "!", "not"),
    DOUBLE_NOT(false, "!!"),
    IF(true, "if", "?:"),

    LOOSE_EQ(false, "=="),
    STRICT_EQ(false, "==="),
    LOOSE_NE(false, "!="),
    STRICT_NE(false, "!=="),
    GT(false, ">"),
    GE(false, ">="),
    LT(false, "<"),
    LE(false, "<="),

    ADD(false, "+"),
    SUBTRACT(false, "-"),
    MULTIPLY(false, "*"),
    DIVIDE(false, "/"),
    MODULO(false, "%"),
    MIN(false, "min"),
    MAX(false, "max"),

    IN(false, "in"),
    CAT(false, "cat"),
    SUBSTR(false, "substr"),
    MERGE(false, "merge"),

    MAP(true, "map"),
    FILTER(true, "filter"),
    REDUCE(true, "reduce"),
    ALL(true, "all"),
    NONE(true, "none"),
    SOME(true, "some"),

    MISSING(false, "missing"),
    MISSING_SOME(false, "missing_some");

    /** Reserved key for variable references; not an operator but never available to custom operators. */
    public static final String VAR = "var";

    private static final Map<String, Operator> BY_SYMBOL;

    static {
        Map<String, Operator> m = new HashMap<>();
        for (Operator op : values()) {
            for (String s : op.symbols) m.put(s, op);
        }
        BY_SYMBOL = Collections.unmodifiableMap(m);
    }

    private final boolean lazy;
    private final List<String> symbols;

    Operator(boolean lazy, String... symbols) {
        this.lazy = lazy;
        this.symbols = List.of(symbols);
    }

    public boolean isLazy() {
        return lazy;
    }

    public List<String> symbols() {
        return symbols;
    }

    /** The built-in operator for a symbol, or null. */
    public static Operator fromSymbol(String symbol) {
        return symbol != null ? BY_SYMBOL.get(symbol) : null;
    }

    /** True for every built-in symbol and for {@code var}. */
    public static boolean isReserved(String symbol) {
        return VAR.equals(symbol) || BY_SYMBOL.containsKey(symbol);
    }

    public static Set<String> allSymbols() {
        return BY_SYMBOL.keySet();
    }
}
