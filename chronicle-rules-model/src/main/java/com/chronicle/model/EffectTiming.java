package com.chronicle.model;

/**
 * Phase in which an effect runs while its owning event or encounter is resolved.
 * Declaration order is execution order.
 */
public enum EffectTiming {
    PRE,
    ON_RESOLVE,
    POST
}
