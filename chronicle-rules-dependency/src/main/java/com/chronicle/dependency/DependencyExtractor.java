package com.chronicle.dependency;

import com.chronicle.expression.Expression;
import com.chronicle.expression.Literal;
import com.chronicle.expression.Operation;
import com.chronicle.expression.VarRef;
import com.chronicle.model.Effect;
import com.chronicle.model.PatchOp;
import com.chronicle.model.PatchOpType;
import com.chronicle.patch.JsonPointers;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Extracts the base variables an expression reads and the base variables an effect writes.
 * <p>
 * Dependencies are tracked per base variable: {@code settlement.population} and {@code settlement.tags}
 * both read {@code settlement}, and a write to {@code /variables/settlement/tags/0} writes {@code settlement}.
 * Writes come from add/replace/remove/move/copy targets plus the source of a move (which is removed).
 * The effect's own reads are the targets of test operations and the source of a copy.
 * Results keep first-seen order and contain no duplicates.
 */
public final class DependencyExtractor {

    private static final String VAR = "var";

    private DependencyExtractor() {
    }

    public static Set<String> extractReads(Expression expression) {
        Set<String> out = new LinkedHashSet<>();
        if (expression != null) collect(expression, out);
        return Collections.unmodifiableSet(out);
    }

    /**
     * Walks the raw wire form, so it also works for expressions that would not parse. Null and scalar input
     * yields the empty set.
     */
    public static Set<String> extractReads(JsonNode expression) {
        Set<String> out = new LinkedHashSet<>();
        if (expression != null) collect(expression, out);
        return Collections.unmodifiableSet(out);
    }

    /** Union of the reads of every expression. */
    public static Set<String> extractReadsFromMultiple(Collection<JsonNode> expressions) {
        Set<String> out = new LinkedHashSet<>();
        if (expressions == null) return Collections.unmodifiableSet(out);
        for (JsonNode e : expressions) {
            if (e != null) collect(e, out);
        }
        return Collections.unmodifiableSet(out);
    }

    public static boolean readsVariable(JsonNode expression, String name) {
        return name != null && extractReads(expression).contains(name);
    }

    public static Set<String> extractWrites(Effect effect) {
        Set<String> out = new LinkedHashSet<>();
        if (effect == null) return Collections.unmodifiableSet(out);
        for (PatchOp op : effect.getPayload()) {
            PatchOpType type = op != null ? op.getType() : null;
            if (type == null || type == PatchOpType.TEST) continue;
            addVariable(op.getPath(), out);
            if (type == PatchOpType.MOVE) addVariable(op.getFrom(), out);
        }
        return Collections.unmodifiableSet(out);
    }

    /** Variables the effect's payload inspects: test targets and copy sources. */
    public static Set<String> extractEffectReads(Effect effect) {
        Set<String> out = new LinkedHashSet<>();
        if (effect == null) return Collections.unmodifiableSet(out);
        for (PatchOp op : effect.getPayload()) {
            PatchOpType type = op != null ? op.getType() : null;
            if (type == PatchOpType.TEST) addVariable(op.getPath(), out);
            if (type == PatchOpType.COPY) addVariable(op.getFrom(), out);
        }
        return Collections.unmodifiableSet(out);
    }

    private static void addVariable(String pointer, Set<String> out) {
        String name = JsonPointers.variableName(pointer);
        if (name != null) out.add(name);
    }

    private static void collect(Expression e, Set<String> out) {
        switch (e.kind()) {
            case VAR -> {
                VarRef ref = (VarRef) e;
                if (!ref.isEmpty()) out.add(ref.baseName());
                if (ref.defaultValue() != null) collect(ref.defaultValue(), out);
            }
            case OPERATION -> {
                for (Expression a : ((Operation) e).args()) collect(a, out);
            }
            case LITERAL -> {
                for (Expression element : ((Literal) e).elements()) collect(element, out);
            }
        }
    }

    private static void collect(JsonNode node, Set<String> out) {
        if (node.isArray()) {
            for (JsonNode element : node) collect(element, out);
            return;
        }
        if (!node.isObject()) return;
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            JsonNode value = entry.getValue();
            if (VAR.equals(entry.getKey())) {
                JsonNode path = value.isArray() ? value.path(0) : value;
                if (path.isTextual() || path.isNumber()) {
                    String text = path.asText();
                    int dot = text.indexOf('.');
                    String base = dot < 0 ? text : text.substring(0, dot);
                    if (!base.isEmpty()) out.add(base);
                }
                if (value.isArray() && value.size() > 1) collect(value.get(1), out);
            } else {
                collect(value, out);
            }
        }
    }
}
