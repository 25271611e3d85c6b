package com.chronicle.expression;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named custom operators consulted after the built-ins. Built-in names and {@code var} cannot be
 * registered; a name can only be registered once.
 */
public final class OperatorRegistry {

    private final Map<String, CustomOperator> byName = new ConcurrentHashMap<>();

    public static OperatorRegistry empty() {
        return new OperatorRegistry();
    }

    /**
     * @throws IllegalArgumentException when the name is blank, built in, or already registered
     */
    public OperatorRegistry register(String name, CustomOperator operator) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(operator, "operator");
        if (name.isBlank()) throw new IllegalArgumentException("name must be non-blank");
        if (Operator.isReserved(name)) {
            throw new IllegalArgumentException("Cannot override built-in operator: " + name);
        }
        if (byName.putIfAbsent(name, operator) != null) {
            throw new IllegalArgumentException("Operator already registered: " + name);
        }
        return this;
    }

    /** Returns the operator, or null if none is registered under the name. */
    public CustomOperator get(String name) {
        return name != null ? byName.get(name) : null;
    }

    public boolean contains(String name) {
        return name != null && byName.containsKey(name);
    }

    public Set<String> names() {
        return Set.copyOf(byName.keySet());
    }
}
