package com.chronicle.resolution;

import com.chronicle.dependency.graph.DependencyGraph;
import com.chronicle.model.Condition;
import com.chronicle.model.Effect;
import com.chronicle.model.EffectTiming;
import com.chronicle.model.EntityType;
import com.chronicle.model.RulesJson;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EffectChainGuardTest {

    private static Condition reads(String id, String variable) {
        return new Condition(id, EntityType.EVENT, "ev-1", null,
                RulesJson.readTree("{\"var\": \"" + variable + "\"}"), null, 0, true, 1);
    }

    private static Effect writes(String id, String conditionId, String variable) {
        return new Effect(id, EntityType.EVENT, "ev-1", EffectTiming.POST, 0,
                RulesJson.payloadFromJson("[ { \"op\": \"add\", \"path\": \"/variables/" + variable + "/level\", \"value\": 1 } ]"),
                conditionId, true, null);
    }

    @Test
    void twoEffectsFeedingEachOthersGuardsFormACycle() {
        Map<String, Condition> conditions = Map.of("c-a", reads("c-a", "b"), "c-b", reads("c-b", "a"));
        List<Effect> effects = List.of(writes("writes-a", "c-a", "a"), writes("writes-b", "c-b", "b"), writes("free", null, "c"));
        assertEquals(Set.of("writes-a", "writes-b"), EffectChainGuard.cyclicEffects(effects, conditions));
    }

    @Test
    void oneWayChainIsNotACycle() {
        Map<String, Condition> conditions = Map.of("c-a", reads("c-a", "x"));
        List<Effect> effects = List.of(writes("reader", "c-a", "y"), writes("writer", null, "x"));
        DependencyGraph graph = EffectChainGuard.effectGraph(effects, conditions);
        assertEquals(Set.of("EFFECT:writer"), graph.dependenciesOf("EFFECT:reader"));
        assertTrue(EffectChainGuard.cyclicEffects(effects, conditions).isEmpty());
    }

    @Test
    void selfFeedingEffectAndInactiveGuardHandling() {
        Condition inactive = new Condition("c-off", EntityType.EVENT, "ev-1", null,
                RulesJson.readTree("{\"var\": \"z\"}"), null, 0, false, 1);
        Map<String, Condition> conditions = Map.of("c-self", reads("c-self", "s"), "c-off", inactive);
        List<Effect> effects = List.of(writes("self", "c-self", "s"), writes("off", "c-off", "z"));
        assertEquals(Set.of("self"), EffectChainGuard.cyclicEffects(effects, conditions));
        assertTrue(EffectChainGuard.cyclicEffects(List.of(), conditions).isEmpty());
    }
}
