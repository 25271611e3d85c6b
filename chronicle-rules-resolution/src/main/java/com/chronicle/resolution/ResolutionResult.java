package com.chronicle.resolution;

import com.chronicle.model.EffectTiming;
import com.chronicle.model.EntitySnapshot;

import java.util.Objects;

/**
 * Outcome of resolving one encounter or event: the final entity snapshot and one summary per effect phase.
 * {@code resolved} is false only when the core action failed; {@code error} then carries its message and the
 * ON_RESOLVE and POST summaries are {@link PhaseStatus#NOT_RUN}.
 */
public record ResolutionResult(String resolutionId, EntitySnapshot entity, boolean resolved, String error,
                               EffectExecutionSummary pre, EffectExecutionSummary onResolve, EffectExecutionSummary post) {

    public ResolutionResult {
        Objects.requireNonNull(resolutionId, "resolutionId");
        Objects.requireNonNull(entity, "entity");
        pre = pre != null ? pre : EffectExecutionSummary.notRun(EffectTiming.PRE);
        onResolve = onResolve != null ? onResolve : EffectExecutionSummary.notRun(EffectTiming.ON_RESOLVE);
        post = post != null ? post : EffectExecutionSummary.notRun(EffectTiming.POST);
    }

    public EffectExecutionSummary summary(EffectTiming timing) {
        return switch (timing) {
            case PRE -> pre;
            case ON_RESOLVE -> onResolve;
            case POST -> post;
        };
    }

    /** True when any phase recorded an effect error. */
    public boolean hasEffectErrors() {
        return pre.hasErrors() || onResolve.hasErrors() || post.hasErrors();
    }
}
