package com.chronicle.resolution.ledger;

import com.chronicle.model.EntityRef;
import com.chronicle.resolution.EffectExecutionResult;

/**
 * Write-only store for resolution audit records: one start, one entry per effect attempt, one end.
 * {@link ResolutionAuditTrail} wraps all calls in try/catch so a resolution never fails on auditing.
 */
public interface ResolutionLedger {

    void resolutionStarted(String resolutionId, EntityRef entity, int effectCount, long startTimeMillis);

    void effectExecuted(String resolutionId, EffectExecutionResult result, long timeMillis);

    void resolutionEnded(String resolutionId, boolean resolved, String errorMessage, long endTimeMillis);

    /** Resolution end with duration. Stores that keep no duration can ignore it. */
    default void resolutionEnded(String resolutionId, boolean resolved, String errorMessage, long endTimeMillis, Long durationMs) {
        resolutionEnded(resolutionId, resolved, errorMessage, endTimeMillis);
    }
}
