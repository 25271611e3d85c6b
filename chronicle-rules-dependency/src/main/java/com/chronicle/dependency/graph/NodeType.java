package com.chronicle.dependency.graph;

/** Kind of dependency graph node. */
public enum NodeType {
    VARIABLE,
    CONDITION,
    EFFECT,
    ENTITY
}
