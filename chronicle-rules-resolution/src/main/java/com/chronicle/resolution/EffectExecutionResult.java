package com.chronicle.resolution;

import com.chronicle.model.EffectTiming;
import com.chronicle.patch.VariableDiff;

import java.util.Objects;

/**
 * Outcome of one effect attempt within a phase. A skipped effect was not applied (guard false, guard error or
 * missing guard); its {@code error} is set only when the skip was caused by an error.
 */
public record EffectExecutionResult(String effectId, EffectTiming phase, boolean success, boolean skipped,
                                    String error, String errorType, VariableDiff diff) {

    public EffectExecutionResult {
        Objects.requireNonNull(effectId, "effectId");
        Objects.requireNonNull(phase, "phase");
        diff = diff != null ? diff : VariableDiff.empty();
    }

    public static EffectExecutionResult succeeded(String effectId, EffectTiming phase, VariableDiff diff) {
        return new EffectExecutionResult(effectId, phase, true, false, null, null, diff);
    }

    public static EffectExecutionResult failed(String effectId, EffectTiming phase, String errorType, String error) {
        return new EffectExecutionResult(effectId, phase, false, false, error, errorType, null);
    }

    public static EffectExecutionResult skipped(String effectId, EffectTiming phase) {
        return new EffectExecutionResult(effectId, phase, false, true, null, null, null);
    }

    public static EffectExecutionResult skipped(String effectId, EffectTiming phase, String errorType, String error) {
        return new EffectExecutionResult(effectId, phase, false, true, error, errorType, null);
    }

    public boolean failed() {
        return !success && !skipped;
    }

    /** Ledger and metrics outcome label: succeeded, failed or skipped. */
    public String outcome() {
        if (success) return "succeeded";
        return skipped ? "skipped" : "failed";
    }
}
