package com.chronicle.resolution;

import com.chronicle.model.EffectTiming;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Per-phase summary: counts, one error entry per failed effect (and per effect skipped because of an error),
 * every attempt's result and the order in which effects were attempted.
 */
public record EffectExecutionSummary(EffectTiming phase, PhaseStatus status, int total, int succeeded, int failed,
                                     int skipped, List<EffectError> errors, List<EffectExecutionResult> results,
                                     List<String> executionOrder) {

    public record EffectError(String effectId, String message) {
    }

    public EffectExecutionSummary {
        Objects.requireNonNull(phase, "phase");
        Objects.requireNonNull(status, "status");
        errors = errors != null ? List.copyOf(errors) : List.of();
        results = results != null ? List.copyOf(results) : List.of();
        executionOrder = executionOrder != null ? List.copyOf(executionOrder) : List.of();
    }

    /** Summary for a phase that never started. */
    public static EffectExecutionSummary notRun(EffectTiming phase) {
        return new EffectExecutionSummary(phase, PhaseStatus.NOT_RUN, 0, 0, 0, 0, null, null, null);
    }

    /** Builds the summary from attempt results in execution order. */
    public static EffectExecutionSummary of(EffectTiming phase, List<EffectExecutionResult> results) {
        int succeeded = 0;
        int failed = 0;
        int skipped = 0;
        int skippedWithError = 0;
        List<EffectError> errors = new ArrayList<>();
        List<String> order = new ArrayList<>();
        for (EffectExecutionResult r : results) {
            order.add(r.effectId());
            if (r.success()) {
                succeeded++;
            } else if (r.skipped()) {
                skipped++;
                if (r.error() != null) {
                    skippedWithError++;
                    errors.add(new EffectError(r.effectId(), r.error()));
                }
            } else {
                failed++;
                errors.add(new EffectError(r.effectId(), r.error()));
            }
        }
        return new EffectExecutionSummary(phase, PhaseStatus.of(succeeded, failed, skippedWithError),
                results.size(), succeeded, failed, skipped, errors, results, order);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
