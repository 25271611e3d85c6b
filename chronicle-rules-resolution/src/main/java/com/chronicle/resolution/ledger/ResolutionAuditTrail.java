package com.chronicle.resolution.ledger;

import com.chronicle.model.EntityRef;
import com.chronicle.resolution.EffectExecutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fail-safe facade for the resolution ledger. All writes delegate to {@link ResolutionLedger};
 * any exception from the store is caught, logged and not rethrown so resolution never fails.
 */
public final class ResolutionAuditTrail {

    private static final Logger log = LoggerFactory.getLogger(ResolutionAuditTrail.class);

    private final ResolutionLedger store;

    public ResolutionAuditTrail(ResolutionLedger store) {
        this.store = store != null ? store : new NoOpResolutionLedger();
    }

    public ResolutionLedger getStore() {
        return store;
    }

    public void resolutionStarted(String resolutionId, EntityRef entity, int effectCount, long startTimeMillis) {
        try {
            store.resolutionStarted(resolutionId, entity, effectCount, startTimeMillis);
        } catch (Throwable t) {
            log.warn("Ledger resolutionStarted failed (resolutionId={}); resolution continues. Error: {}", resolutionId, t.getMessage(), t);
        }
    }

    public void effectExecuted(String resolutionId, EffectExecutionResult result, long timeMillis) {
        try {
            store.effectExecuted(resolutionId, result, timeMillis);
        } catch (Throwable t) {
            log.warn("Ledger effectExecuted failed (resolutionId={}, effectId={}); resolution continues. Error: {}",
                    resolutionId, result.effectId(), t.getMessage(), t);
        }
    }

    public void resolutionEnded(String resolutionId, boolean resolved, String errorMessage, long endTimeMillis, Long durationMs) {
        try {
            store.resolutionEnded(resolutionId, resolved, errorMessage, endTimeMillis, durationMs);
        } catch (Throwable t) {
            log.warn("Ledger resolutionEnded failed (resolutionId={}); resolution continues. Error: {}", resolutionId, t.getMessage(), t);
        }
    }
}
