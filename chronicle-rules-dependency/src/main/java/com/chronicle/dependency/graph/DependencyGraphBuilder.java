package com.chronicle.dependency.graph;

import com.chronicle.dependency.DependencyExtractor;
import com.chronicle.expression.Expression;
import com.chronicle.expression.ExpressionException;
import com.chronicle.expression.ExpressionParser;
import com.chronicle.model.Condition;
import com.chronicle.model.Effect;
import com.chronicle.model.EntityRef;
import com.chronicle.model.PatchOp;
import com.chronicle.patch.JsonPointers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the dependency graph of one campaign branch from its conditions, effects and entities.
 * <p>
 * Nodes: one VARIABLE per base variable, one CONDITION per active condition, one EFFECT per active effect,
 * one ENTITY per distinct owner (type-level rules hang off {@code ENTITY:<TYPE>:*}).
 * Edges: CONDITION -READS-> VARIABLE; EFFECT -WRITES-> VARIABLE; EFFECT -READS-> VARIABLE for test targets and
 * copy sources; ENTITY -DEPENDS_ON-> CONDITION/EFFECT it owns; EFFECT -DEPENDS_ON-> its guard CONDITION.
 * <p>
 * Inactive records are left out. Records that cannot become nodes (null entries, duplicate ids, missing or
 * unparseable expressions) are skipped and reported as warnings; building never fails on bad data.
 */
public final class DependencyGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    public GraphBuildResult build(List<Condition> conditions, List<Effect> effects, List<EntityRef> entities) {
        DependencyGraph graph = new DependencyGraph();
        List<String> warnings = new ArrayList<>();

        if (entities != null) {
            for (EntityRef ref : entities) {
                if (ref != null) addEntity(graph, ref);
            }
        }
        if (conditions != null) {
            for (Condition c : conditions) addCondition(graph, c, warnings);
        }
        List<Effect> added = new ArrayList<>();
        if (effects != null) {
            for (Effect e : effects) {
                if (addEffect(graph, e, warnings)) added.add(e);
            }
        }
        for (Effect e : added) {
            linkGuard(graph, e, warnings);
        }

        CycleReport cycles = CycleDetection.detect(graph);
        GraphBuildResult result = new GraphBuildResult(graph, cycles, warnings);
        log.info("Dependency graph built | nodes={} | edges={} | cycleParticipants={} | warnings={}",
                graph.nodeCount(), graph.edgeCount(), cycles.nodesInCycles().size(), warnings.size());
        return result;
    }

    private static String addEntity(DependencyGraph graph, EntityRef ref) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("entityType", ref.entityType().name());
        meta.put("typeLevel", ref.isTypeLevel());
        DependencyNode node = new DependencyNode(DependencyNode.entityId(ref), NodeType.ENTITY, ref.entityId(), ref.key(), meta);
        return graph.addNode(node).id();
    }

    private static String addVariable(DependencyGraph graph, String name) {
        Map<String, Object> meta = Map.of("name", name);
        return graph.addNode(new DependencyNode(DependencyNode.variableId(name), NodeType.VARIABLE, null, name, meta)).id();
    }

    private static void addCondition(DependencyGraph graph, Condition c, List<String> warnings) {
        if (c == null) {
            warnings.add("Skipped null condition record");
            return;
        }
        if (!c.isActive()) {
            log.debug("Condition skipped | conditionId={} | reason=inactive", c.getId());
            return;
        }
        String nodeId = DependencyNode.conditionId(c.getId());
        if (graph.hasNode(nodeId)) {
            warnings.add("Skipped condition " + c.getId() + ": duplicate id");
            return;
        }
        if (c.getExpression() == null || c.getExpression().isNull() || c.getExpression().isMissingNode()) {
            warnings.add("Skipped condition " + c.getId() + ": expression is missing");
            return;
        }
        Expression parsed;
        try {
            parsed = ExpressionParser.parse(c.getExpression());
        } catch (ExpressionException e) {
            warnings.add("Skipped condition " + c.getId() + ": " + e.getMessage());
            return;
        }

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("entityType", c.getEntityType().name());
        if (c.getEntityId() != null) meta.put("entityId", c.getEntityId());
        if (c.getField() != null) meta.put("field", c.getField());
        meta.put("priority", c.getPriority());
        if (c.getDescription() != null) meta.put("description", c.getDescription());
        String label = c.getField() != null ? c.getEntityType().name() + "." + c.getField() : c.getId();
        graph.addNode(new DependencyNode(nodeId, NodeType.CONDITION, c.getEntityId(), label, meta));

        String ownerId = addEntity(graph, c.getOwner());
        graph.addEdge(DependencyEdge.of(ownerId, nodeId, EdgeType.DEPENDS_ON));
        for (String variable : DependencyExtractor.extractReads(parsed)) {
            String varId = addVariable(graph, variable);
            graph.addEdge(new DependencyEdge(nodeId, varId, EdgeType.READS, Map.of("variable", variable)));
        }
    }

    private static boolean addEffect(DependencyGraph graph, Effect e, List<String> warnings) {
        if (e == null) {
            warnings.add("Skipped null effect record");
            return false;
        }
        if (!e.isActive()) {
            log.debug("Effect skipped | effectId={} | reason=inactive", e.getId());
            return false;
        }
        String nodeId = DependencyNode.effectId(e.getId());
        if (graph.hasNode(nodeId)) {
            warnings.add("Skipped effect " + e.getId() + ": duplicate id");
            return false;
        }
        List<PatchOp> payload = e.getPayload();
        for (int i = 0; i < payload.size(); i++) {
            PatchOp op = payload.get(i);
            if (op == null || op.getType() == null || !JsonPointers.isValid(op.getPath())) {
                warnings.add("Effect " + e.getId() + ": operation " + i + " is malformed and contributes no dependencies");
            }
        }

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("entityType", e.getEntityType().name());
        if (e.getEntityId() != null) meta.put("entityId", e.getEntityId());
        meta.put("timing", e.getTiming().name());
        meta.put("priority", e.getPriority());
        if (e.getConditionId() != null) meta.put("conditionId", e.getConditionId());
        String label = e.getDescription() != null ? e.getDescription() : e.getId();
        graph.addNode(new DependencyNode(nodeId, NodeType.EFFECT, e.getEntityId(), label, meta));

        String ownerId = addEntity(graph, e.getOwner());
        graph.addEdge(DependencyEdge.of(ownerId, nodeId, EdgeType.DEPENDS_ON));
        for (String variable : DependencyExtractor.extractWrites(e)) {
            String varId = addVariable(graph, variable);
            graph.addEdge(new DependencyEdge(nodeId, varId, EdgeType.WRITES, Map.of("variable", variable)));
        }
        for (String variable : DependencyExtractor.extractEffectReads(e)) {
            String varId = addVariable(graph, variable);
            graph.addEdge(new DependencyEdge(nodeId, varId, EdgeType.READS, Map.of("variable", variable)));
        }
        return true;
    }

    private static void linkGuard(DependencyGraph graph, Effect e, List<String> warnings) {
        if (e.getConditionId() == null) return;
        String guardId = DependencyNode.conditionId(e.getConditionId());
        if (!graph.hasNode(guardId)) {
            warnings.add("Effect " + e.getId() + ": guard condition " + e.getConditionId() + " is missing or inactive");
            return;
        }
        graph.addEdge(new DependencyEdge(DependencyNode.effectId(e.getId()), guardId, EdgeType.DEPENDS_ON,
                Map.of("role", "guard")));
    }
}
