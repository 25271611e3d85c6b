package com.chronicle.resolution;

import com.chronicle.expression.ExpressionEvaluator;
import com.chronicle.model.Condition;
import com.chronicle.model.Effect;
import com.chronicle.model.EffectTiming;
import com.chronicle.model.EntitySnapshot;
import com.chronicle.patch.PatchEngine;
import com.chronicle.resolution.ledger.ResolutionAuditTrail;
import com.chronicle.resolution.ledger.ResolutionLedger;
import com.chronicle.resolution.metrics.ResolutionMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Resolves one encounter or event: PRE effects, the core action, ON_RESOLVE effects, POST effects.
 * <p>
 * Phases run in that order and never go back. Effect failures stay inside their phase summary; only a failure of
 * the core action stops the resolution, in which case ON_RESOLVE and POST do not run and the returned snapshot is
 * the one PRE produced. The pipeline holds no per-entity state; callers keep at most one resolution in flight
 * per entity.
 */
public final class EffectResolutionPipeline {

    private static final Logger log = LoggerFactory.getLogger(EffectResolutionPipeline.class);

    private final EffectPhaseRunner runner;
    private final ResolutionAuditTrail auditTrail;
    private final ResolutionMetrics metrics;
    private final boolean refuseCyclicEffects;

    public EffectResolutionPipeline() {
        this(new ExpressionEvaluator(), new PatchEngine(), null, new ResolutionMetrics(), false);
    }

    public EffectResolutionPipeline(ExpressionEvaluator evaluator, PatchEngine patchEngine, ResolutionLedger ledger,
                                    ResolutionMetrics metrics, boolean refuseCyclicEffects) {
        this.auditTrail = new ResolutionAuditTrail(ledger);
        this.metrics = metrics != null ? metrics : new ResolutionMetrics();
        this.runner = new EffectPhaseRunner(evaluator, patchEngine, auditTrail, this.metrics);
        this.refuseCyclicEffects = refuseCyclicEffects;
    }

    public boolean isRefuseCyclicEffects() {
        return refuseCyclicEffects;
    }

    /**
     * @param entity     snapshot of the encounter or event being resolved
     * @param effects    candidate effects; inactive ones and those owned by other entities are ignored
     * @param conditions guard conditions by id
     * @param action     core action run between PRE and ON_RESOLVE
     */
    public ResolutionResult resolve(EntitySnapshot entity, List<Effect> effects, Map<String, Condition> conditions,
                                    ResolutionAction action) {
        Objects.requireNonNull(entity, "entity");
        Objects.requireNonNull(action, "action");
        Map<String, Condition> guards = conditions != null ? conditions : Map.of();
        String resolutionId = UUID.randomUUID().toString();
        long startNanos = System.nanoTime();
        long startMillis = System.currentTimeMillis();

        List<Effect> pre = EffectPhaseRunner.select(effects, EffectTiming.PRE, entity);
        List<Effect> onResolve = EffectPhaseRunner.select(effects, EffectTiming.ON_RESOLVE, entity);
        List<Effect> post = EffectPhaseRunner.select(effects, EffectTiming.POST, entity);
        Set<String> refused = Set.of();
        if (refuseCyclicEffects) {
            List<Effect> all = new ArrayList<>(pre);
            all.addAll(onResolve);
            all.addAll(post);
            refused = EffectChainGuard.cyclicEffects(all, guards);
            if (!refused.isEmpty()) {
                log.warn("Refusing effects on cyclic write chain | entity={} | effectIds={}", entity.getRef(), refused);
            }
        }

        log.info("Resolution started | resolutionId={} | entity={} | pre={} | onResolve={} | post={}",
                resolutionId, entity.getRef(), pre.size(), onResolve.size(), post.size());
        auditTrail.resolutionStarted(resolutionId, entity.getRef(), pre.size() + onResolve.size() + post.size(), startMillis);

        EffectPhaseRunner.PhaseRun preRun = runner.run(resolutionId, EffectTiming.PRE, pre, entity, guards, refused);
        EntitySnapshot current = preRun.entity();

        EntitySnapshot afterAction;
        try {
            afterAction = action.apply(current);
            if (afterAction == null) {
                throw new ResolutionActionException(current.getRef(), "Resolution action returned no entity");
            }
        } catch (RuntimeException e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("Resolution action failed | resolutionId={} | entity={} | error={}", resolutionId, current.getRef(), message);
            return finish(new ResolutionResult(resolutionId, current, false, message, preRun.summary(), null, null),
                    startNanos, startMillis);
        }

        EffectPhaseRunner.PhaseRun onResolveRun = runner.run(resolutionId, EffectTiming.ON_RESOLVE, onResolve, afterAction, guards, refused);
        EffectPhaseRunner.PhaseRun postRun = runner.run(resolutionId, EffectTiming.POST, post, onResolveRun.entity(), guards, refused);

        return finish(new ResolutionResult(resolutionId, postRun.entity(), true, null,
                preRun.summary(), onResolveRun.summary(), postRun.summary()), startNanos, startMillis);
    }

    /**
     * Runs one effect against the entity outside a resolution, with the same guard and payload handling as a phase.
     * A dry run writes no ledger entries and records no metrics; otherwise the attempt is audited under a fresh
     * execution id as a one-effect resolution.
     */
    public EffectRun execute(EntitySnapshot entity, Effect effect, Map<String, Condition> conditions, boolean dryRun) {
        Objects.requireNonNull(entity, "entity");
        Objects.requireNonNull(effect, "effect");
        Map<String, Condition> guards = conditions != null ? conditions : Map.of();
        EffectPhaseRunner.Attempt attempt = runner.attempt(effect, effect.getTiming(), entity, guards);
        EffectExecutionResult result = attempt.result();
        EffectPhaseRunner.logResult(result, entity);
        if (dryRun) {
            log.info("Effect previewed | effectId={} | entity={} | outcome={}", effect.getId(), entity.getRef(), result.outcome());
            return new EffectRun(null, true, result, attempt.entity());
        }
        String executionId = UUID.randomUUID().toString();
        long startMillis = System.currentTimeMillis();
        auditTrail.resolutionStarted(executionId, entity.getRef(), 1, startMillis);
        auditTrail.effectExecuted(executionId, result, startMillis);
        long endMillis = System.currentTimeMillis();
        auditTrail.resolutionEnded(executionId, !result.failed(), result.error(), endMillis, endMillis - startMillis);
        metrics.recordEffect(result);
        log.info("Effect executed | executionId={} | effectId={} | entity={} | outcome={}",
                executionId, effect.getId(), entity.getRef(), result.outcome());
        return new EffectRun(executionId, false, result, attempt.entity());
    }

    private ResolutionResult finish(ResolutionResult result, long startNanos, long startMillis) {
        long durationNanos = System.nanoTime() - startNanos;
        long endMillis = System.currentTimeMillis();
        auditTrail.resolutionEnded(result.resolutionId(), result.resolved(), result.error(), endMillis, endMillis - startMillis);
        metrics.recordResolution(result.entity().getRef().entityType(), result.resolved(), durationNanos);
        log.info("Resolution ended | resolutionId={} | entity={} | resolved={} | durationMs={}",
                result.resolutionId(), result.entity().getRef(), result.resolved(), durationNanos / 1_000_000);
        return result;
    }
}
