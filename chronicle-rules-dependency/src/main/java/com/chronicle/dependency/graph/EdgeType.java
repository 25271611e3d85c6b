package com.chronicle.dependency.graph;

/** Kind of dependency graph edge; edges point from the dependent node to what it depends on. */
public enum EdgeType {
    /** Condition or effect reads a variable. */
    READS,
    /** Effect writes a variable. */
    WRITES,
    /** Entity owns a condition or effect, or an effect is guarded by a condition. */
    DEPENDS_ON
}
