package com.chronicle.patch;

import java.util.ArrayList;
import java.util.List;

/**
 * RFC 6901 JSON Pointer helpers.
 */
public final class JsonPointers {

    public static final String VARIABLES_PREFIX = "/variables/";

    private JsonPointers() {
    }

    /**
     * Splits a pointer into unescaped reference tokens ({@code ~1} becomes {@code /}, {@code ~0} becomes {@code ~}).
     *
     * @throws IllegalArgumentException when the pointer is non-empty and does not start with {@code /}
     */
    public static List<String> parse(String pointer) {
        if (pointer == null) throw new IllegalArgumentException("pointer is null");
        List<String> tokens = new ArrayList<>();
        if (pointer.isEmpty()) return tokens;
        if (pointer.charAt(0) != '/') {
            throw new IllegalArgumentException("JSON pointer must start with '/': " + pointer);
        }
        int start = 1;
        while (true) {
            int slash = pointer.indexOf('/', start);
            String raw = slash < 0 ? pointer.substring(start) : pointer.substring(start, slash);
            tokens.add(unescape(raw));
            if (slash < 0) break;
            start = slash + 1;
        }
        return tokens;
    }

    static String unescape(String token) {
        if (token.indexOf('~') < 0) return token;
        return token.replace("~1", "/").replace("~0", "~");
    }

    public static boolean isValid(String pointer) {
        return pointer != null && pointer.startsWith("/");
    }

    /** First token of the pointer, or null for an invalid or root pointer. */
    public static String topLevelField(String pointer) {
        if (!isValid(pointer)) return null;
        return parse(pointer).get(0);
    }

    /** True when the pointer addresses something inside the variables object. */
    public static boolean isVariablePath(String pointer) {
        return pointer != null && pointer.startsWith(VARIABLES_PREFIX) && pointer.length() > VARIABLES_PREFIX.length();
    }

    /**
     * Base variable a pointer addresses: the first unescaped token after {@code /variables/}
     * ({@code gold} for {@code /variables/gold/amount}). Null for pointers outside the variables object and for
     * {@code /variables} or {@code /variables/} alone.
     */
    public static String variableName(String pointer) {
        if (!isVariablePath(pointer)) return null;
        List<String> tokens = parse(pointer);
        String name = tokens.size() > 1 ? tokens.get(1) : null;
        return name != null && !name.isEmpty() ? name : null;
    }
}
