package com.chronicle.resolution;

import com.chronicle.dependency.DependencyExtractor;
import com.chronicle.dependency.graph.CycleDetection;
import com.chronicle.dependency.graph.CycleReport;
import com.chronicle.dependency.graph.DependencyEdge;
import com.chronicle.dependency.graph.DependencyGraph;
import com.chronicle.dependency.graph.DependencyNode;
import com.chronicle.dependency.graph.EdgeType;
import com.chronicle.dependency.graph.NodeType;
import com.chronicle.model.Condition;
import com.chronicle.model.Effect;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds effects that feed their own guards. Effect F depends on effect E when E writes a base variable that
 * F's guard condition reads; effects on a cycle of that relation (including an effect whose writes feed its own
 * guard) form a cyclic write chain.
 */
public final class EffectChainGuard {

    private EffectChainGuard() {
    }

    /** Effect-to-effect graph; node ids are {@code EFFECT:<id>}. Unguarded effects are isolated nodes. */
    public static DependencyGraph effectGraph(Collection<Effect> effects, Map<String, Condition> conditions) {
        DependencyGraph graph = new DependencyGraph();
        List<Effect> active = effects.stream().filter(e -> e != null && e.isActive()).toList();
        for (Effect e : active) {
            graph.addNode(new DependencyNode(DependencyNode.effectId(e.getId()), NodeType.EFFECT, e.getEntityId(), e.getId(), null));
        }
        for (Effect reader : active) {
            Set<String> guardReads = guardReads(reader, conditions);
            if (guardReads.isEmpty()) continue;
            for (Effect writer : active) {
                for (String variable : DependencyExtractor.extractWrites(writer)) {
                    if (!guardReads.contains(variable)) continue;
                    graph.addEdge(new DependencyEdge(DependencyNode.effectId(reader.getId()),
                            DependencyNode.effectId(writer.getId()), EdgeType.DEPENDS_ON, Map.of("variable", variable)));
                    break;
                }
            }
        }
        return graph;
    }

    /** Ids of effects (not node ids) that sit on a cyclic write chain. */
    public static Set<String> cyclicEffects(Collection<Effect> effects, Map<String, Condition> conditions) {
        if (effects == null || effects.isEmpty()) return Set.of();
        CycleReport report = CycleDetection.detect(effectGraph(effects, conditions != null ? conditions : Map.of()));
        if (!report.hasCycles()) return Set.of();
        Set<String> ids = new LinkedHashSet<>();
        String prefix = NodeType.EFFECT.name() + ":";
        for (String nodeId : report.nodesInCycles()) ids.add(nodeId.substring(prefix.length()));
        return Collections.unmodifiableSet(ids);
    }

    private static Set<String> guardReads(Effect effect, Map<String, Condition> conditions) {
        if (effect.getConditionId() == null) return Set.of();
        Condition guard = conditions.get(effect.getConditionId());
        if (guard == null || !guard.isActive()) return Set.of();
        return DependencyExtractor.extractReads(guard.getExpression());
    }
}
