package com.chronicle.expression;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered record of the nodes visited while evaluating one expression, in pre-order (a node's step
 * comes before its arguments' steps). Branches skipped by short-circuiting never appear.
 * Not thread-safe; one trace per evaluation.
 */
public final class ExecutionTrace {

    private final boolean enabled;
    private final List<String> operations = new ArrayList<>();
    private final List<JsonNode> inputs = new ArrayList<>();
    private final List<JsonNode> outputs = new ArrayList<>();

    public ExecutionTrace() {
        this(true);
    }

    private ExecutionTrace(boolean enabled) {
        this.enabled = enabled;
    }

    /** A trace that records nothing. */
    public static ExecutionTrace disabled() {
        return new ExecutionTrace(false);
    }

    public boolean isEnabled() {
        return enabled;
    }

    /** Opens a step for a node about to be evaluated; returns its index (or -1 when disabled). */
    int begin(String operation, JsonNode input) {
        if (!enabled) return -1;
        operations.add(operation);
        inputs.add(input);
        outputs.add(null);
        return operations.size() - 1;
    }

    void complete(int index, JsonNode output) {
        if (index >= 0) outputs.set(index, output);
    }

    public int size() {
        return operations.size();
    }

    public List<TraceStep> steps() {
        List<TraceStep> out = new ArrayList<>(operations.size());
        for (int i = 0; i < operations.size(); i++) {
            out.add(new TraceStep(i + 1, operations.get(i), inputs.get(i), outputs.get(i)));
        }
        return List.copyOf(out);
    }
}
