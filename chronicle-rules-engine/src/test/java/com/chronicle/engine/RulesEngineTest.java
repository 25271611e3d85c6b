package com.chronicle.engine;

import com.chronicle.dependency.graph.EdgeType;
import com.chronicle.dependency.graph.GraphBuildResult;
import com.chronicle.dependency.graph.GraphView;
import com.chronicle.dependency.graph.NodeType;
import com.chronicle.dependency.graph.SelectionImpact;
import com.chronicle.dependency.graph.TopologicalOrder;
import com.chronicle.engine.config.RulesEngineConfig;
import com.chronicle.engine.load.CampaignSnapshotLoader;
import com.chronicle.engine.load.InMemoryRulesSource;
import com.chronicle.expression.EvaluationResult;
import com.chronicle.expression.OperatorRegistry;
import com.chronicle.model.Condition;
import com.chronicle.model.Effect;
import com.chronicle.model.EffectTiming;
import com.chronicle.model.EntityRef;
import com.chronicle.model.EntitySnapshot;
import com.chronicle.model.EntityType;
import com.chronicle.model.RulesJson;
import com.chronicle.model.VariableState;
import com.chronicle.resolution.PhaseStatus;
import com.chronicle.resolution.ResolutionResult;
import com.chronicle.resolution.ledger.InMemoryResolutionLedger;
import com.chronicle.resolution.metrics.ResolutionMetrics;
import com.fasterxml.jackson.databind.node.IntNode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RulesEngineTest {

    private static final EntityRef SETTLEMENT = EntityRef.of(EntityType.SETTLEMENT, "s-1");
    private static final EntityRef ENCOUNTER = EntityRef.of(EntityType.ENCOUNTER, "enc-1");

    private final InMemoryResolutionLedger ledger = new InMemoryResolutionLedger();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();

    private static Condition condition(String id, EntityRef owner, String field, String expressionJson, boolean active) {
        return new Condition(id, owner.entityType(), owner.entityId(), field, RulesJson.readTree(expressionJson),
                null, 0, active, 1);
    }

    private static Effect effect(String id, EffectTiming timing, int priority, String conditionId, String payloadJson) {
        return new Effect(id, EntityType.ENCOUNTER, "enc-1", timing, priority, RulesJson.payloadFromJson(payloadJson),
                conditionId, true, null);
    }

    private static EntitySnapshot snapshot(EntityRef ref, String variablesJson) {
        return EntitySnapshot.of(ref, VariableState.of(RulesJson.readTree(variablesJson)));
    }

    private static InMemoryRulesSource campaign() {
        List<Condition> conditions = List.of(
                condition("c-trade", SETTLEMENT, "isTradeHub",
                        "{ \"==\": [ { \"var\": \"settlement.tags\" }, \"trade_hub\" ] }", true),
                condition("c-threat", ENCOUNTER, null, "{ \">\": [ { \"var\": \"threat\" }, 2 ] }", true),
                condition("c-old", ENCOUNTER, null, "{ \"var\": \"threat\" }", false),
                condition("c-broken", ENCOUNTER, null, "{ \"teleport\": [ 1 ] }", true));
        List<Effect> effects = List.of(
                effect("pre-bad", EffectTiming.PRE, 0, null,
                        "[ { \"op\": \"add\", \"path\": \"variables/x\", \"value\": 1 } ]"),
                effect("reward", EffectTiming.ON_RESOLVE, 5, "c-threat",
                        "[ { \"op\": \"add\", \"path\": \"/variables/gold\", \"value\": 50 } ]"),
                effect("calm", EffectTiming.ON_RESOLVE, 1, null,
                        "[ { \"op\": \"replace\", \"path\": \"/variables/threat\", \"value\": 0 } ]"),
                effect("log", EffectTiming.POST, 0, null,
                        "[ { \"op\": \"add\", \"path\": \"/variables/resolvedCount\", \"value\": 1 } ]"));
        List<EntitySnapshot> entities = List.of(
                snapshot(SETTLEMENT, "{ \"settlement\": { \"tags\": [\"trade_hub\"] } }"),
                snapshot(ENCOUNTER, "{ \"threat\": 3 }"));
        return new InMemoryRulesSource().put("c-1", "main", conditions, effects, entities);
    }

    private RulesEngine engine(RulesEngineConfig config) {
        return RulesEngine.builder()
                .source(campaign())
                .config(config)
                .ledger(ledger)
                .meterRegistry(registry)
                .build();
    }

    private RulesEngine engine() {
        return engine(RulesEngineConfig.defaults());
    }

    @Test
    void arrayLooselyEqualsItsSingleElement() {
        EvaluationResult result = engine().evaluateCondition("c-trade",
                RulesJson.readTree("{ \"settlement\": { \"tags\": [\"trade_hub\"] } }"));

        assertTrue(result.success());
        assertTrue(result.value().asBoolean());
        assertFalse(result.trace().isEmpty());
    }

    @Test
    void traceCanBeTurnedOff() {
        RulesEngine engine = engine(RulesEngineConfig.builder().includeTrace(false).build());
        EvaluationResult result = engine.evaluateCondition("c-threat", RulesJson.readTree("{ \"threat\": 1 }"));

        assertTrue(result.success());
        assertFalse(result.value().asBoolean());
        assertTrue(result.trace().isEmpty());
    }

    @Test
    void missingInactiveAndBrokenConditionsAreUnsuccessfulResults() {
        RulesEngine engine = engine();

        EvaluationResult missing = engine.evaluateCondition("c-none", null);
        assertFalse(missing.success());
        assertEquals(RulesEngine.CONDITION_NOT_FOUND, missing.errorType());

        EvaluationResult inactive = engine.evaluateCondition("c-old", null);
        assertFalse(inactive.success());
        assertEquals(RulesEngine.CONDITION_INACTIVE, inactive.errorType());

        EvaluationResult broken = engine.evaluateCondition("c-broken", null);
        assertFalse(broken.success());
        assertEquals("UnknownOperator", broken.errorType());
    }

    @Test
    void batchEvaluationKeepsRequestOrder() {
        Map<String, EvaluationResult> results = engine().evaluateConditions(
                List.of("c-threat", "c-none", "c-trade", "c-threat"),
                RulesJson.readTree("{ \"threat\": 5, \"settlement\": { \"tags\": \"market\" } }"));

        assertEquals(List.of("c-threat", "c-none", "c-trade"), List.copyOf(results.keySet()));
        assertTrue(results.get("c-threat").value().asBoolean());
        assertFalse(results.get("c-none").success());
        assertFalse(results.get("c-trade").value().asBoolean());
    }

    @Test
    void customOperatorsReachConditions() {
        InMemoryRulesSource source = new InMemoryRulesSource().put("c-1", "main",
                List.of(condition("c-days", ENCOUNTER, null, "{ \">=\": [ { \"daysSince\": [ 10 ] }, 7 ] }", true)),
                List.of(), List.of());
        RulesEngine engine = RulesEngine.builder()
                .source(source)
                .operators(OperatorRegistry.empty().register("daysSince", args -> IntNode.valueOf(12 - args.get(0).asInt())))
                .build();

        assertFalse(engine.evaluateCondition("c-days", null).value().asBoolean());
    }

    @Test
    void validationUsesConfiguredDepth() {
        RulesEngine engine = engine(RulesEngineConfig.builder().maxExpressionDepth(2).build());

        assertTrue(engine.validateExpression(RulesJson.readTree("{ \"!\": [ true ] }")).valid());
        assertFalse(engine.validateExpression(RulesJson.readTree("{ \"!\": [ { \"!\": [ { \"!\": [ true ] } ] } ] }")).valid());
        assertFalse(engine.validateCondition(condition("x", ENCOUNTER, null, "{ \"teleport\": [] }", true)).valid());
    }

    @Test
    void resolveEncounterRunsAllPhases() {
        ResolutionResult result = engine().resolveEncounter("enc-1");

        assertTrue(result.resolved());
        assertEquals(PhaseStatus.ALL_FAILED, result.pre().status());
        assertEquals(List.of("reward", "calm"), result.onResolve().executionOrder());
        assertEquals(PhaseStatus.SUCCEEDED, result.onResolve().status());
        assertEquals(PhaseStatus.SUCCEEDED, result.post().status());
        assertEquals(VariableState.of(RulesJson.readTree("{ \"threat\": 0, \"gold\": 50, \"resolvedCount\": 1 }")),
                result.entity().getVariables());
        assertTrue(result.entity().flag("isResolved"));

        InMemoryResolutionLedger.Entry entry = ledger.get(result.resolutionId());
        assertTrue(entry.isEnded());
        assertTrue(entry.isResolved());
        assertEquals(4, entry.getEffects().size());
        assertEquals(1L, registry.get(ResolutionMetrics.RESOLUTION_TIMER).timer().count());
    }

    @Test
    void alreadyResolvedEncounterIsRefused() {
        EntitySnapshot done = snapshot(ENCOUNTER, "{ \"threat\": 3 }");
        done = done.withDocument(done.getDocument().put("isResolved", true));
        InMemoryRulesSource source = new InMemoryRulesSource().put("c-1", "main", List.of(),
                List.of(effect("reward", EffectTiming.ON_RESOLVE, 0, null,
                        "[ { \"op\": \"add\", \"path\": \"/variables/gold\", \"value\": 50 } ]")),
                List.of(done));

        ResolutionResult result = RulesEngine.builder().source(source).build().resolveEncounter("enc-1");

        assertFalse(result.resolved());
        assertEquals("Encounter with ID enc-1 is already resolved", result.error());
        assertEquals(PhaseStatus.NOT_RUN, result.onResolve().status());
        assertFalse(result.entity().getVariables().toObjectNode().has("gold"));
    }

    @Test
    void unknownEntityIsReported() {
        EntityNotFoundException e = assertThrows(EntityNotFoundException.class, () -> engine().resolveEvent("ev-9"));

        assertEquals(EntityRef.of(EntityType.EVENT, "ev-9"), e.getEntity());
        assertEquals("Event with ID ev-9 not found", e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> engine().resolveEncounter(" "));
    }

    @Test
    void dependencyGraphLinksConditionsToBaseVariables() {
        GraphView view = engine().getDependencyGraph("c-1", null);

        assertTrue(view.edges().stream().anyMatch(e -> e.fromId().equals("CONDITION:c-trade")
                && e.toId().equals("VARIABLE:settlement") && e.type() == EdgeType.READS));
        assertTrue(view.edges().stream().anyMatch(e -> e.fromId().equals("EFFECT:reward")
                && e.toId().equals("CONDITION:c-threat") && e.type() == EdgeType.DEPENDS_ON));
        assertEquals(2, view.stats().count(NodeType.ENTITY));
        assertEquals("SETTLEMENT.isTradeHub", view.node("CONDITION:c-trade").label());
        assertTrue(view.cycles().isEmpty());
    }

    @Test
    void selectionImpactAndEvaluationOrder() {
        RulesEngine engine = engine();

        SelectionImpact impact = engine.getSelectionImpact("c-1", "main", Set.of("VARIABLE:threat"), null);
        assertTrue(impact.downstream().isEmpty());
        assertTrue(impact.upstream().containsAll(Set.of("CONDITION:c-threat", "EFFECT:calm", "EFFECT:reward",
                "ENTITY:ENCOUNTER:enc-1")));

        TopologicalOrder order = engine.getEvaluationOrder("c-1", "main");
        assertTrue(order.isComplete());
        assertTrue(order.order().indexOf("VARIABLE:threat") < order.order().indexOf("CONDITION:c-threat"));
    }

    @Test
    void graphIsCachedUntilInvalidated() {
        RulesEngine engine = engine();

        engine.getDependencyGraph("c-1", "main");
        GraphBuildResult cached = engine.getGraphCache().get("c-1", "main");
        engine.getDependencyGraph("c-1", null);
        assertSame(cached, engine.getGraphCache().get("c-1", "main"));

        engine.invalidateDependencyGraph("c-1", "main");
        engine.getDependencyGraph("c-1", "main");
        assertNotSame(cached, engine.getGraphCache().get("c-1", "main"));

        assertEquals(1, engine.invalidateCampaign("c-1"));
    }

    @Test
    void disabledCacheStoresNothing() {
        RulesEngine engine = engine(RulesEngineConfig.builder().graphCacheEnabled(false).build());
        engine.getDependencyGraph("c-1", "main");

        assertEquals(0, engine.getGraphCache().size());
    }

    @Test
    void snapshotWarningsReachTheGraphView(@TempDir Path dir) throws IOException {
        Files.createDirectories(dir.resolve("c-2"));
        Files.writeString(dir.resolve("c-2").resolve("main.json"), """
                {
                  "conditions": [ { "entityType": "KINGDOM", "expression": true } ],
                  "entities": [ { "entityType": "KINGDOM", "entityId": "k-1", "variables": { "stability": 4 } } ]
                }
                """);
        RulesEngine engine = RulesEngine.builder().source(new CampaignSnapshotLoader(dir)).build();

        GraphView view = engine.getDependencyGraph("c-2", "main");

        assertEquals(1, view.warnings().size());
        assertTrue(view.warnings().get(0).startsWith("conditions[0]"));
        assertEquals(1, view.stats().nodeCount());
    }

    @Test
    void guardsComeFromTheBranchHoldingTheEntity() {
        Condition closed = condition("g1", ENCOUNTER, null, "false", true);
        Condition open = condition("g1", ENCOUNTER, null, "true", true);
        Effect grant = effect("e1", EffectTiming.ON_RESOLVE, 0, "g1",
                "[ { \"op\": \"add\", \"path\": \"/variables/gold\", \"value\": 5 } ]");
        InMemoryRulesSource source = new InMemoryRulesSource()
                .put("c-1", "other", List.of(closed), List.of(), List.of())
                .put("c-1", "main", List.of(open), List.of(grant), List.of(snapshot(ENCOUNTER, "{}")));
        RulesEngine engine = RulesEngine.builder().source(source).ledger(ledger).meterRegistry(registry).build();

        ResolutionResult result = engine.resolveEncounter("enc-1");

        assertEquals(1, result.onResolve().succeeded());
        assertEquals(0, result.onResolve().skipped());
        assertEquals(5, result.entity().getVariables().get("gold").asInt());
    }

    @Test
    void previewEffectAppliesPayloadWithoutAuditing() {
        RulesEngine engine = engine();

        EffectExecution preview = engine.previewEffect("calm");

        assertTrue(preview.success());
        assertTrue(preview.dryRun());
        assertEquals(ENCOUNTER, preview.target());
        assertEquals(0, preview.entity().getVariables().get("threat").asInt());
        assertEquals(Set.of("threat"), preview.diff().modified().keySet());
        assertEquals(0, ledger.size());
        assertEquals(3, engine.getSource().findEntity(ENCOUNTER).orElseThrow().getVariables().get("threat").asInt());
    }

    @Test
    void executeEffectChecksGuardAndAudits() {
        RulesEngine engine = engine();

        EffectExecution reward = engine.executeEffect("reward", false);
        assertTrue(reward.success());
        assertFalse(reward.dryRun());
        assertEquals(50, reward.entity().getVariables().get("gold").asInt());
        assertTrue(ledger.get(reward.executionId()).isEnded());

        EffectExecution broken = engine.executeEffect("pre-bad", false);
        assertFalse(broken.success());
        assertFalse(broken.skipped());
        assertEquals("InvalidPatchSyntax", broken.errorType());
        assertEquals(ENCOUNTER, broken.entity().getRef());
        assertEquals(2, ledger.size());
    }

    @Test
    void effectsThatCannotRunComeBackAsResults() {
        Effect dormant = new Effect("dormant", EntityType.ENCOUNTER, "enc-1", EffectTiming.POST, 0,
                RulesJson.payloadFromJson("[]"), null, false, null);
        Effect everyEncounter = new Effect("every", EntityType.ENCOUNTER, null, EffectTiming.POST, 0,
                RulesJson.payloadFromJson("[ { \"op\": \"add\", \"path\": \"/variables/seen\", \"value\": true } ]"));
        Effect orphan = new Effect("orphan", EntityType.ENCOUNTER, "enc-9", EffectTiming.POST, 0,
                RulesJson.payloadFromJson("[]"));
        InMemoryRulesSource source = new InMemoryRulesSource().put("c-1", "main", List.of(),
                List.of(dormant, everyEncounter, orphan), List.of(snapshot(ENCOUNTER, "{}")));
        RulesEngine engine = RulesEngine.builder().source(source).ledger(ledger).build();

        assertEquals(RulesEngine.EFFECT_NOT_FOUND, engine.executeEffect("nope", false).errorType());
        assertEquals(RulesEngine.EFFECT_INACTIVE, engine.previewEffect("dormant").errorType());
        assertEquals(RulesEngine.ENTITY_REQUIRED, engine.previewEffect("every").errorType());
        assertEquals(RulesEngine.EFFECT_NOT_APPLICABLE,
                engine.executeEffect("every", EntityRef.of(EntityType.EVENT, "ev-1"), true).errorType());
        EffectExecution orphaned = engine.executeEffect("orphan", false);
        assertEquals(RulesEngine.ENTITY_NOT_FOUND, orphaned.errorType());
        assertEquals("Encounter with ID enc-9 not found", orphaned.error());
        assertEquals(0, ledger.size());

        EffectExecution targeted = engine.executeEffect("every", ENCOUNTER, true);
        assertTrue(targeted.success());
        assertTrue(targeted.entity().getVariables().get("seen").asBoolean());
    }
}
