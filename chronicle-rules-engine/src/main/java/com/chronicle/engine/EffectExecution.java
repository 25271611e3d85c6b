package com.chronicle.engine;

import com.chronicle.model.EntityRef;
import com.chronicle.model.EntitySnapshot;
import com.chronicle.patch.VariableDiff;
import com.chronicle.resolution.EffectExecutionResult;
import com.chronicle.resolution.EffectRun;

import java.util.Objects;

/**
 * Outcome of executing or previewing one stored effect. When the effect could not be run at all (unknown,
 * inactive, no target entity) {@code entity} and {@code executionId} are null and {@code errorType} says why.
 * {@code executionId} is also null for dry runs.
 */
public record EffectExecution(String effectId, EntityRef target, String executionId, boolean dryRun, boolean success,
                              boolean skipped, String errorType, String error, VariableDiff diff, EntitySnapshot entity) {

    public EffectExecution {
        Objects.requireNonNull(effectId, "effectId");
        diff = diff != null ? diff : VariableDiff.empty();
    }

    static EffectExecution notRun(String effectId, EntityRef target, boolean dryRun, String errorType, String error) {
        return new EffectExecution(effectId, target, null, dryRun, false, false, errorType, error, null, null);
    }

    static EffectExecution of(EffectRun run) {
        EffectExecutionResult result = run.result();
        return new EffectExecution(result.effectId(), run.entity().getRef(), run.executionId(), run.dryRun(),
                result.success(), result.skipped(), result.errorType(), result.error(), result.diff(), run.entity());
    }
}
