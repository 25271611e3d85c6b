package com.chronicle.model;

/**
 * The six canonical patch operation kinds.
 */
public enum PatchOpType {
    ADD("add", true, false),
    REMOVE("remove", false, false),
    REPLACE("replace", true, false),
    MOVE("move", false, true),
    COPY("copy", false, true),
    TEST("test", true, false);

    private final String wireName;
    private final boolean requiresValue;
    private final boolean requiresFrom;

    PatchOpType(String wireName, boolean requiresValue, boolean requiresFrom) {
        this.wireName = wireName;
        this.requiresValue = requiresValue;
        this.requiresFrom = requiresFrom;
    }

    /** Lower-case name used in JSON payloads. */
    public String wireName() {
        return wireName;
    }

    public boolean requiresValue() {
        return requiresValue;
    }

    public boolean requiresFrom() {
        return requiresFrom;
    }

    /** Returns the kind for a wire name (case-sensitive), or null if unknown. */
    public static PatchOpType fromWireName(String name) {
        if (name == null) return null;
        for (PatchOpType t : values()) {
            if (t.wireName.equals(name)) return t;
        }
        return null;
    }
}
