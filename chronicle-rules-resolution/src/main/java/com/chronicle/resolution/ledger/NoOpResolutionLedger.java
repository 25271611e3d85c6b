package com.chronicle.resolution.ledger;

import com.chronicle.model.EntityRef;
import com.chronicle.resolution.EffectExecutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Default ledger when no store is configured. Logs so the audit path is visible but keeps nothing. */
public final class NoOpResolutionLedger implements ResolutionLedger {

    private static final Logger log = LoggerFactory.getLogger(NoOpResolutionLedger.class);

    @Override
    public void resolutionStarted(String resolutionId, EntityRef entity, int effectCount, long startTimeMillis) {
        log.info("Ledger (no-op): resolutionStarted | resolutionId={} | entity={} | effects={}", resolutionId, entity, effectCount);
    }

    @Override
    public void effectExecuted(String resolutionId, EffectExecutionResult result, long timeMillis) {
        log.debug("Ledger (no-op): effectExecuted | resolutionId={} | effectId={} | phase={} | outcome={}",
                resolutionId, result.effectId(), result.phase(), result.outcome());
    }

    @Override
    public void resolutionEnded(String resolutionId, boolean resolved, String errorMessage, long endTimeMillis) {
        log.info("Ledger (no-op): resolutionEnded | resolutionId={} | resolved={}", resolutionId, resolved);
    }
}
