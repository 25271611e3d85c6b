package com.chronicle.resolution;

import com.chronicle.expression.EvaluationResult;
import com.chronicle.expression.Expression;
import com.chronicle.expression.ExpressionEvaluator;
import com.chronicle.expression.ExpressionException;
import com.chronicle.expression.ExpressionParser;
import com.chronicle.model.Condition;
import com.chronicle.model.Effect;
import com.chronicle.model.EffectTiming;
import com.chronicle.model.EntitySnapshot;
import com.chronicle.patch.PatchEngine;
import com.chronicle.patch.PatchException;
import com.chronicle.patch.PatchResult;
import com.chronicle.resolution.ledger.ResolutionAuditTrail;
import com.chronicle.resolution.metrics.ResolutionMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Single responsibility: run the effects of one timing phase against one entity, sequentially.
 * <p>
 * Effects run in descending priority (ties keep input order). Each effect's guard is evaluated against the
 * entity's current variables right before its turn. A failed effect is recorded and the phase moves on with the
 * last successfully patched snapshot.
 */
public final class EffectPhaseRunner {

    private static final Logger log = LoggerFactory.getLogger(EffectPhaseRunner.class);

    static final String CYCLIC_CHAIN = "CyclicEffectChain";
    static final String GUARD_MISSING = "GuardMissing";
    static final String UNEXPECTED = "Unexpected";

    private final ExpressionEvaluator evaluator;
    private final PatchEngine patchEngine;
    private final ResolutionAuditTrail auditTrail;
    private final ResolutionMetrics metrics;

    public EffectPhaseRunner(ExpressionEvaluator evaluator, PatchEngine patchEngine,
                             ResolutionAuditTrail auditTrail, ResolutionMetrics metrics) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.patchEngine = Objects.requireNonNull(patchEngine, "patchEngine");
        this.auditTrail = Objects.requireNonNull(auditTrail, "auditTrail");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /** Summary of a phase plus the snapshot the next step starts from. */
    public record PhaseRun(EffectExecutionSummary summary, EntitySnapshot entity) {
    }

    /**
     * Active effects of the given timing that apply to the entity, in execution order.
     */
    public static List<Effect> select(List<Effect> effects, EffectTiming timing, EntitySnapshot entity) {
        List<Effect> out = new ArrayList<>();
        if (effects == null) return out;
        for (Effect e : effects) {
            if (e != null && e.isActive() && e.getTiming() == timing && e.appliesTo(entity.getRef())) out.add(e);
        }
        out.sort(Comparator.comparingInt(Effect::getPriority).reversed());
        return out;
    }

    /** One effect attempt and the snapshot it left; the input snapshot when the effect did not apply. */
    public record Attempt(EffectExecutionResult result, EntitySnapshot entity) {
    }

    public PhaseRun run(String resolutionId, EffectTiming timing, List<Effect> ordered, EntitySnapshot entity,
                        Map<String, Condition> conditions, Set<String> refused) {
        EntitySnapshot current = entity;
        List<EffectExecutionResult> results = new ArrayList<>(ordered.size());
        for (Effect effect : ordered) {
            EffectExecutionResult result;
            if (refused.contains(effect.getId())) {
                result = EffectExecutionResult.failed(effect.getId(), timing, CYCLIC_CHAIN,
                        "Effect " + effect.getId() + " participates in a cyclic write chain");
            } else {
                Attempt attempt = attempt(effect, timing, current, conditions);
                result = attempt.result();
                current = attempt.entity();
            }
            logResult(result, entity);
            results.add(result);
            auditTrail.effectExecuted(resolutionId, result, System.currentTimeMillis());
            metrics.recordEffect(result);
        }
        EffectExecutionSummary summary = EffectExecutionSummary.of(timing, results);
        log.info("Phase complete | entity={} | phase={} | status={} | total={} | succeeded={} | failed={} | skipped={}",
                entity.getRef(), timing, summary.status(), summary.total(), summary.succeeded(), summary.failed(), summary.skipped());
        return new PhaseRun(summary, current);
    }

    /**
     * Checks the effect's guard against the entity's variables and, when it passes, applies the payload.
     * Nothing is audited or counted here.
     */
    public Attempt attempt(Effect effect, EffectTiming timing, EntitySnapshot entity, Map<String, Condition> conditions) {
        EffectExecutionResult skipped = checkGuard(effect, timing, entity, conditions);
        if (skipped != null) {
            return new Attempt(skipped, entity);
        }
        try {
            PatchResult patched = patchEngine.apply(entity, effect.getPayload());
            return new Attempt(EffectExecutionResult.succeeded(effect.getId(), timing, patched.diff()),
                    entity.withDocument(patched.document()));
        } catch (PatchException e) {
            return new Attempt(EffectExecutionResult.failed(effect.getId(), timing, e.getErrorType(), e.getMessage()), entity);
        } catch (RuntimeException e) {
            log.warn("Effect raised an unexpected error | effectId={} | phase={}", effect.getId(), timing, e);
            return new Attempt(EffectExecutionResult.failed(effect.getId(), timing, UNEXPECTED,
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()), entity);
        }
    }

    /** Returns null when the effect may run, otherwise the skip result. */
    private EffectExecutionResult checkGuard(Effect effect, EffectTiming timing, EntitySnapshot entity,
                                             Map<String, Condition> conditions) {
        String guardId = effect.getConditionId();
        if (guardId == null) return null;
        Condition guard = conditions.get(guardId);
        if (guard == null || !guard.isActive()) {
            return EffectExecutionResult.skipped(effect.getId(), timing, GUARD_MISSING,
                    "Guard condition " + guardId + " is missing or inactive");
        }
        if (guard.getExpression() == null || guard.getExpression().isNull()) {
            return EffectExecutionResult.skipped(effect.getId(), timing, GUARD_MISSING,
                    "Guard condition " + guardId + " has no expression");
        }
        EvaluationResult evaluation;
        try {
            Expression parsed = ExpressionParser.parse(guard.getExpression());
            evaluation = evaluator.evaluate(parsed, entity.getVariables().toObjectNode(), false);
        } catch (ExpressionException e) {
            evaluation = EvaluationResult.failure(e, List.of());
        }
        if (!evaluation.success()) {
            return EffectExecutionResult.skipped(effect.getId(), timing, evaluation.errorType(),
                    "Guard condition " + guardId + " failed: " + evaluation.error());
        }
        if (!evaluation.isTruthy()) {
            return EffectExecutionResult.skipped(effect.getId(), timing);
        }
        return null;
    }

    static void logResult(EffectExecutionResult result, EntitySnapshot entity) {
        if (result.failed()) {
            log.warn("Effect failed | entity={} | effectId={} | phase={} | errorType={} | error={}",
                    entity.getRef(), result.effectId(), result.phase(), result.errorType(), result.error());
        } else {
            log.debug("Effect {} | entity={} | effectId={} | phase={}",
                    result.outcome(), entity.getRef(), result.effectId(), result.phase());
        }
    }
}
