package com.chronicle.model;

/**
 * Kinds of campaign entity that own conditions, effects and variable state.
 */
public enum EntityType {
    SETTLEMENT,
    STRUCTURE,
    KINGDOM,
    PARTY,
    CHARACTER,
    ENCOUNTER,
    EVENT
}
