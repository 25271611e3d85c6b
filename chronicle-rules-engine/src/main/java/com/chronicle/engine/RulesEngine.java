package com.chronicle.engine;

import com.chronicle.dependency.graph.DependencyGraphBuilder;
import com.chronicle.dependency.graph.GraphBuildResult;
import com.chronicle.dependency.graph.GraphView;
import com.chronicle.dependency.graph.SelectionImpact;
import com.chronicle.dependency.graph.TopologicalOrder;
import com.chronicle.engine.cache.DependencyGraphCache;
import com.chronicle.engine.config.RulesEngineConfig;
import com.chronicle.engine.load.CampaignRules;
import com.chronicle.engine.load.CampaignSnapshotLoader;
import com.chronicle.engine.load.RulesSource;
import com.chronicle.expression.EvaluationResult;
import com.chronicle.expression.Expression;
import com.chronicle.expression.ExpressionException;
import com.chronicle.expression.ExpressionEvaluator;
import com.chronicle.expression.ExpressionParser;
import com.chronicle.expression.ExpressionValidationResult;
import com.chronicle.expression.ExpressionValidator;
import com.chronicle.expression.OperatorRegistry;
import com.chronicle.model.Condition;
import com.chronicle.model.Effect;
import com.chronicle.model.EntityRef;
import com.chronicle.model.EntitySnapshot;
import com.chronicle.model.EntityType;
import com.chronicle.patch.PatchEngine;
import com.chronicle.resolution.EffectResolutionPipeline;
import com.chronicle.resolution.ResolutionAction;
import com.chronicle.resolution.ResolutionActions;
import com.chronicle.resolution.ResolutionResult;
import com.chronicle.resolution.ledger.ResolutionLedger;
import com.chronicle.resolution.metrics.ResolutionMetrics;
import com.fasterxml.jackson.databind.JsonNode;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Query surface of the rules engine: condition evaluation, encounter and event resolution, single effect
 * execution, and dependency graph queries over the records of a {@link RulesSource}.
 * <p>
 * Domain failures come back as results ({@link EvaluationResult}, {@link ResolutionResult}, {@link EffectExecution},
 * graph warnings).
 * The only exception callers see for a well-formed request is {@link EntityNotFoundException} when a resolution
 * names an unknown entity. Nothing is persisted here; callers store the returned entity snapshot.
 */
public final class RulesEngine {

    private static final Logger log = LoggerFactory.getLogger(RulesEngine.class);

    static final String CONDITION_NOT_FOUND = "ConditionNotFound";
    static final String CONDITION_INACTIVE = "ConditionInactive";
    static final String EFFECT_NOT_FOUND = "EffectNotFound";
    static final String EFFECT_INACTIVE = "EffectInactive";
    static final String EFFECT_NOT_APPLICABLE = "EffectNotApplicable";
    static final String ENTITY_REQUIRED = "EntityRequired";
    static final String ENTITY_NOT_FOUND = "EntityNotFound";

    private final RulesSource source;
    private final RulesEngineConfig config;
    private final ExpressionEvaluator evaluator;
    private final ExpressionValidator validator;
    private final EffectResolutionPipeline pipeline;
    private final DependencyGraphBuilder graphBuilder = new DependencyGraphBuilder();
    private final DependencyGraphCache graphCache = new DependencyGraphCache();

    private RulesEngine(Builder b) {
        this.config = b.config != null ? b.config : RulesEngineConfig.defaults();
        this.source = b.source != null ? b.source : new CampaignSnapshotLoader(Path.of(config.getSnapshotDir()));
        OperatorRegistry registry = b.operators != null ? b.operators : OperatorRegistry.empty();
        this.evaluator = new ExpressionEvaluator(registry);
        this.validator = new ExpressionValidator(registry, config.getMaxExpressionDepth());
        ResolutionMetrics metrics = b.meterRegistry != null ? new ResolutionMetrics(b.meterRegistry) : new ResolutionMetrics();
        this.pipeline = new EffectResolutionPipeline(evaluator, new PatchEngine(), b.ledger, metrics,
                config.isRefuseCyclicEffects());
        log.info("Rules engine created | source={} | maxExpressionDepth={} | includeTrace={} | graphCache={} | refuseCyclicEffects={}",
                source.getClass().getSimpleName(), config.getMaxExpressionDepth(), config.isIncludeTrace(),
                config.isGraphCacheEnabled(), config.isRefuseCyclicEffects());
    }

    public static Builder builder() {
        return new Builder();
    }

    public RulesEngineConfig getConfig() {
        return config;
    }

    public RulesSource getSource() {
        return source;
    }

    public DependencyGraphCache getGraphCache() {
        return graphCache;
    }

    // ---- conditions ----

    /**
     * Evaluates a stored condition against the context. Missing or inactive conditions and expression errors
     * come back as unsuccessful results.
     */
    public EvaluationResult evaluateCondition(String conditionId, JsonNode context) {
        Objects.requireNonNull(conditionId, "conditionId");
        Optional<Condition> found = source.findCondition(conditionId);
        if (found.isEmpty()) {
            return EvaluationResult.failure(CONDITION_NOT_FOUND, "Condition with ID " + conditionId + " not found");
        }
        Condition condition = found.get();
        if (!condition.isActive()) {
            return EvaluationResult.failure(CONDITION_INACTIVE, "Condition with ID " + conditionId + " is inactive");
        }
        Expression parsed;
        try {
            parsed = ExpressionParser.parse(condition.getExpression());
        } catch (ExpressionException e) {
            log.debug("Condition expression rejected | conditionId={} | errorType={} | message={}",
                    conditionId, e.getErrorType(), e.getMessage());
            return EvaluationResult.failure(e, List.of());
        }
        EvaluationResult result = evaluator.evaluate(parsed, context, config.isIncludeTrace());
        log.debug("Condition evaluated | conditionId={} | success={} | value={}", conditionId, result.success(), result.value());
        return result;
    }

    /** Evaluates each id in order; the map preserves the request order. */
    public Map<String, EvaluationResult> evaluateConditions(List<String> conditionIds, JsonNode context) {
        Map<String, EvaluationResult> results = new LinkedHashMap<>();
        if (conditionIds == null) return results;
        for (String id : conditionIds) {
            if (id != null && !results.containsKey(id)) {
                results.put(id, evaluateCondition(id, context));
            }
        }
        return results;
    }

    /** Structural check of an expression: shape, operator names and nesting depth. */
    public ExpressionValidationResult validateExpression(JsonNode expression) {
        return validator.validate(expression);
    }

    public ExpressionValidationResult validateCondition(Condition condition) {
        Objects.requireNonNull(condition, "condition");
        return validator.validate(condition.getExpression());
    }

    // ---- resolution ----

    /** Resolves an encounter with the built-in action that marks it resolved. */
    public ResolutionResult resolveEncounter(String encounterId) {
        return resolveEncounter(encounterId, ResolutionActions.markEncounterResolved());
    }

    public ResolutionResult resolveEncounter(String encounterId, ResolutionAction action) {
        return resolve(EntityRef.of(EntityType.ENCOUNTER, encounterId), action);
    }

    /** Resolves an event with the built-in action that marks it completed. */
    public ResolutionResult resolveEvent(String eventId) {
        return resolveEvent(eventId, ResolutionActions.markEventCompleted());
    }

    public ResolutionResult resolveEvent(String eventId, ResolutionAction action) {
        return resolve(EntityRef.of(EntityType.EVENT, eventId), action);
    }

    private ResolutionResult resolve(EntityRef ref, ResolutionAction action) {
        Objects.requireNonNull(action, "action");
        if (ref.isTypeLevel()) {
            throw new IllegalArgumentException(ref.entityType() + " id is required");
        }
        CampaignRules rules = source.findRulesForEntity(ref).orElseThrow(() -> new EntityNotFoundException(ref));
        EntitySnapshot entity = rules.findEntity(ref);
        List<Effect> effects = rules.effectsFor(ref);
        Map<String, Condition> guards = guardsFor(rules, effects);
        log.info("Resolving entity | entity={} | effects={} | guards={}", ref, effects.size(), guards.size());
        return pipeline.resolve(entity, effects, guards, action);
    }

    /** Guard conditions of the effects, looked up in the same branch as the effects themselves. */
    private static Map<String, Condition> guardsFor(CampaignRules rules, List<Effect> effects) {
        Map<String, Condition> guards = new LinkedHashMap<>();
        for (Effect effect : effects) {
            String conditionId = effect.getConditionId();
            if (conditionId != null && !guards.containsKey(conditionId)) {
                Condition c = rules.findCondition(conditionId);
                if (c != null) guards.put(conditionId, c);
            }
        }
        return guards;
    }

    // ---- single effects ----

    /** Dry run of a stored effect against its owning entity: guard and payload are checked, nothing is audited. */
    public EffectExecution previewEffect(String effectId) {
        return executeEffect(effectId, null, true);
    }

    public EffectExecution executeEffect(String effectId, boolean dryRun) {
        return executeEffect(effectId, null, dryRun);
    }

    /**
     * Runs one stored effect outside a resolution, whatever its timing. {@code target} picks the entity for
     * effects owned by a whole entity type and defaults to the effect's owner. Unknown or inactive effects and
     * unknown targets come back as unsuccessful results. The patched snapshot is returned, never persisted.
     */
    public EffectExecution executeEffect(String effectId, EntityRef target, boolean dryRun) {
        Objects.requireNonNull(effectId, "effectId");
        Optional<CampaignRules> found = source.findRulesForEffect(effectId);
        if (found.isEmpty()) {
            return EffectExecution.notRun(effectId, target, dryRun, EFFECT_NOT_FOUND, "Effect with ID " + effectId + " not found");
        }
        CampaignRules rules = found.get();
        Effect effect = rules.findEffect(effectId);
        if (!effect.isActive()) {
            return EffectExecution.notRun(effectId, target, dryRun, EFFECT_INACTIVE, "Effect with ID " + effectId + " is inactive");
        }
        EntityRef ref = target != null ? target : effect.getOwner();
        if (ref.isTypeLevel()) {
            return EffectExecution.notRun(effectId, ref, dryRun, ENTITY_REQUIRED,
                    "Effect " + effectId + " applies to every " + ref.entityType() + "; a target entity is required");
        }
        if (!effect.appliesTo(ref)) {
            return EffectExecution.notRun(effectId, ref, dryRun, EFFECT_NOT_APPLICABLE,
                    "Effect " + effectId + " does not apply to " + ref);
        }
        EntitySnapshot entity = rules.findEntity(ref);
        if (entity == null) {
            return EffectExecution.notRun(effectId, ref, dryRun, ENTITY_NOT_FOUND, new EntityNotFoundException(ref).getMessage());
        }
        log.info("Executing effect | effectId={} | entity={} | dryRun={}", effectId, ref, dryRun);
        return EffectExecution.of(pipeline.execute(entity, effect, guardsFor(rules, List.of(effect)), dryRun));
    }

    // ---- dependency graph ----

    /** Nodes, edges, stats, cycle paths and build warnings of one campaign branch. */
    public GraphView getDependencyGraph(String campaignId, String branchId) {
        return graph(campaignId, branchId).toView();
    }

    /** Union of upstream and downstream of the selected nodes; {@code maxDepth} null or negative is unbounded. */
    public SelectionImpact getSelectionImpact(String campaignId, String branchId, Collection<String> nodeIds,
                                              Integer maxDepth) {
        return SelectionImpact.of(graph(campaignId, branchId).getGraph(), nodeIds, maxDepth);
    }

    /** Dependencies before dependents; nodes on cycles are reported as unordered. */
    public TopologicalOrder getEvaluationOrder(String campaignId, String branchId) {
        return TopologicalOrder.of(graph(campaignId, branchId).getGraph());
    }

    public void invalidateDependencyGraph(String campaignId, String branchId) {
        graphCache.invalidate(campaignId, config.branchOrDefault(branchId));
    }

    public int invalidateCampaign(String campaignId) {
        return graphCache.invalidateCampaign(campaignId);
    }

    GraphBuildResult graph(String campaignId, String branchId) {
        Objects.requireNonNull(campaignId, "campaignId");
        String branch = config.branchOrDefault(branchId);
        if (!config.isGraphCacheEnabled()) {
            return buildGraph(campaignId, branch);
        }
        return graphCache.getOrBuild(campaignId, branch, () -> buildGraph(campaignId, branch));
    }

    private GraphBuildResult buildGraph(String campaignId, String branchId) {
        CampaignRules rules = source.load(campaignId, branchId);
        GraphBuildResult built = graphBuilder.build(rules.conditions(), rules.effects(), rules.entityRefs());
        if (rules.warnings().isEmpty()) {
            return built;
        }
        List<String> warnings = new ArrayList<>(rules.warnings());
        warnings.addAll(built.getWarnings());
        return new GraphBuildResult(built.getGraph(), built.getCycles(), warnings);
    }

    public static final class Builder {
        private RulesSource source;
        private RulesEngineConfig config;
        private OperatorRegistry operators;
        private ResolutionLedger ledger;
        private MeterRegistry meterRegistry;

        private Builder() {
        }

        /** Defaults to a {@link CampaignSnapshotLoader} over the configured snapshot directory. */
        public Builder source(RulesSource source) {
            this.source = source;
            return this;
        }

        public Builder config(RulesEngineConfig config) {
            this.config = config;
            return this;
        }

        public Builder operators(OperatorRegistry operators) {
            this.operators = operators;
            return this;
        }

        public Builder ledger(ResolutionLedger ledger) {
            this.ledger = ledger;
            return this;
        }

        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            return this;
        }

        public RulesEngine build() {
            return new RulesEngine(this);
        }
    }
}
