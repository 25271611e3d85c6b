package com.chronicle.resolution;

import com.chronicle.model.EntitySnapshot;

import java.util.Objects;

/**
 * Outcome of running a single effect outside a resolution. {@code executionId} is null for dry runs;
 * {@code entity} is the patched snapshot, or the input snapshot when the effect did not apply.
 */
public record EffectRun(String executionId, boolean dryRun, EffectExecutionResult result, EntitySnapshot entity) {

    public EffectRun {
        Objects.requireNonNull(result, "result");
        Objects.requireNonNull(entity, "entity");
    }
}
