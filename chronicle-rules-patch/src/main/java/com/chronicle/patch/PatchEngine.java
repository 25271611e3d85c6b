package com.chronicle.patch;

import com.chronicle.model.EntitySnapshot;
import com.chronicle.model.EntityType;
import com.chronicle.model.JsonValues;
import com.chronicle.model.PatchOp;
import com.chronicle.model.PatchOpType;
import com.chronicle.model.VariableState;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Validates and applies patch payloads to entity documents ({@code {"variables": {...}, ...}}).
 * <p>
 * Operations run in array order against a private deep copy; the copy is returned only if every operation
 * succeeds, so a failing operation at any index leaves the input exactly as it was. Inputs are never mutated.
 * Stateless and thread-safe; callers serialize application per entity.
 */
public final class PatchEngine {

    private static final Logger log = LoggerFactory.getLogger(PatchEngine.class);

    private final PatchValidator validator;

    public PatchEngine() {
        this(new PatchValidator());
    }

    public PatchEngine(PatchValidator validator) {
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    public ValidationResult validate(List<PatchOp> ops) {
        return validator.validate(ops);
    }

    public ValidationResult validate(List<PatchOp> ops, EntityType entityType) {
        return validator.validate(ops, entityType);
    }

    /**
     * Applies the payload to a bare variable state (paths address {@code /variables/...}).
     *
     * @throws InvalidPatchSyntaxException when validation fails
     * @throws PatchTestFailedException    when a test operation does not match
     * @throws PathNotFoundException       when an operation references a missing location
     */
    public PatchResult apply(VariableState state, List<PatchOp> ops) {
        ObjectNode doc = JsonNodeFactory.instance.objectNode();
        doc.set(EntitySnapshot.VARIABLES_FIELD, (state != null ? state : VariableState.empty()).toObjectNode());
        return apply(doc, ops, null);
    }

    /** Applies the payload to an entity snapshot's document, protecting the entity type's foreign keys. */
    public PatchResult apply(EntitySnapshot snapshot, List<PatchOp> ops) {
        Objects.requireNonNull(snapshot, "snapshot");
        return apply(snapshot.getDocument(), ops, snapshot.getRef().entityType());
    }

    /**
     * Applies the payload to a document. See {@link #apply(VariableState, List)} for the failure modes.
     */
    public PatchResult apply(ObjectNode document, List<PatchOp> ops, EntityType entityType) {
        Objects.requireNonNull(document, "document");
        ValidationResult validation = validator.validate(ops, entityType);
        if (!validation.isValid()) {
            throw new InvalidPatchSyntaxException(validation);
        }
        ObjectNode working = document.deepCopy();
        for (int i = 0; i < ops.size(); i++) {
            applyOne(working, i, ops.get(i));
        }
        VariableDiff diff = VariableDiff.between(
                VariableState.of(document.get(EntitySnapshot.VARIABLES_FIELD)),
                VariableState.of(working.get(EntitySnapshot.VARIABLES_FIELD)));
        log.debug("Patch applied | ops={} | added={} | modified={} | removed={}",
                ops.size(), diff.added().keySet(), diff.modified().keySet(), diff.removed().keySet());
        return new PatchResult(working, diff, validation.getWarnings());
    }

    /**
     * Computes the outcome of a payload without applying it. Never throws for payload problems.
     */
    public PatchPreview preview(ObjectNode document, List<PatchOp> ops) {
        Objects.requireNonNull(document, "document");
        ObjectNode before = document.deepCopy();
        try {
            PatchResult result = apply(document, ops, null);
            return new PatchPreview(true, before, result.document(), changedFields(before, result.document()), List.of());
        } catch (InvalidPatchSyntaxException e) {
            return new PatchPreview(false, before, null, List.of(), e.getValidation().getErrors());
        } catch (PatchException e) {
            return new PatchPreview(false, before, null, List.of(), List.of(e.getMessage()));
        }
    }

    static List<String> changedFields(ObjectNode before, ObjectNode after) {
        Set<String> names = new LinkedHashSet<>();
        before.fieldNames().forEachRemaining(names::add);
        after.fieldNames().forEachRemaining(names::add);
        List<String> changed = new ArrayList<>();
        for (String name : names) {
            if (!JsonValues.deepEquals(before.get(name), after.get(name)) || before.has(name) != after.has(name)) {
                changed.add(name);
            }
        }
        return changed;
    }

    private static void applyOne(ObjectNode doc, int index, PatchOp op) {
        PatchOpType type = op.getType();
        String path = op.getPath();
        switch (type) {
            case ADD -> add(doc, index, path, op.getValue().deepCopy());
            case REMOVE -> remove(doc, index, path);
            case REPLACE -> replace(doc, index, path, op.getValue().deepCopy());
            case MOVE -> {
                String from = op.getFrom();
                if (!from.equals(path) && path.startsWith(from + "/")) {
                    throw new InvalidPatchSyntaxException(ValidationResult.failure(
                            "Operation " + index + ": cannot move " + from + " into its own child " + path));
                }
                JsonNode value = require(doc, index, from);
                remove(doc, index, from);
                add(doc, index, path, value);
            }
            case COPY -> add(doc, index, path, require(doc, index, op.getFrom()).deepCopy());
            case TEST -> {
                JsonNode actual = locate(doc, path);
                if (actual == null || !JsonValues.deepEquals(actual, op.getValue())) {
                    throw new PatchTestFailedException(index, path, op.getValue(), actual);
                }
            }
        }
    }

    private static JsonNode require(JsonNode doc, int index, String pointer) {
        JsonNode node = locate(doc, pointer);
        if (node == null) throw new PathNotFoundException(index, pointer);
        return node;
    }

    /** The node at the pointer, or null when any step is missing. */
    static JsonNode locate(JsonNode doc, String pointer) {
        JsonNode cur = doc;
        for (String token : JsonPointers.parse(pointer)) {
            if (cur == null) return null;
            if (cur.isObject()) {
                cur = cur.get(token);
            } else if (cur.isArray()) {
                int i = arrayIndex(token, cur.size() - 1);
                cur = i >= 0 ? cur.get(i) : null;
            } else {
                return null;
            }
        }
        return cur;
    }

    private static void add(ObjectNode doc, int index, String pointer, JsonNode value) {
        List<String> tokens = JsonPointers.parse(pointer);
        JsonNode parent = parentOf(doc, index, pointer, tokens);
        String last = tokens.get(tokens.size() - 1);
        if (parent instanceof ObjectNode obj) {
            obj.set(last, value);
        } else if (parent instanceof ArrayNode arr) {
            if ("-".equals(last)) {
                arr.add(value);
                return;
            }
            int i = arrayIndex(last, arr.size());
            if (i < 0) throw new PathNotFoundException(index, pointer);
            arr.insert(i, value);
        } else {
            throw new PathNotFoundException(index, pointer);
        }
    }

    private static void remove(ObjectNode doc, int index, String pointer) {
        List<String> tokens = JsonPointers.parse(pointer);
        JsonNode parent = parentOf(doc, index, pointer, tokens);
        String last = tokens.get(tokens.size() - 1);
        if (parent instanceof ObjectNode obj && obj.has(last)) {
            obj.remove(last);
        } else if (parent instanceof ArrayNode arr && arrayIndex(last, arr.size() - 1) >= 0) {
            arr.remove(arrayIndex(last, arr.size() - 1));
        } else {
            throw new PathNotFoundException(index, pointer);
        }
    }

    private static void replace(ObjectNode doc, int index, String pointer, JsonNode value) {
        List<String> tokens = JsonPointers.parse(pointer);
        JsonNode parent = parentOf(doc, index, pointer, tokens);
        String last = tokens.get(tokens.size() - 1);
        if (parent instanceof ObjectNode obj && obj.has(last)) {
            obj.set(last, value);
        } else if (parent instanceof ArrayNode arr && arrayIndex(last, arr.size() - 1) >= 0) {
            arr.set(arrayIndex(last, arr.size() - 1), value);
        } else {
            throw new PathNotFoundException(index, pointer);
        }
    }

    private static JsonNode parentOf(ObjectNode doc, int index, String pointer, List<String> tokens) {
        if (tokens.isEmpty()) throw new PathNotFoundException(index, pointer);
        JsonNode cur = doc;
        for (int i = 0; i < tokens.size() - 1; i++) {
            String token = tokens.get(i);
            if (cur.isObject()) {
                cur = cur.get(token);
            } else if (cur.isArray()) {
                int idx = arrayIndex(token, cur.size() - 1);
                cur = idx >= 0 ? cur.get(idx) : null;
            } else {
                cur = null;
            }
            if (cur == null) throw new PathNotFoundException(index, pointer);
        }
        return cur;
    }

    /** Parses an array index token; returns -1 unless it is a canonical non-negative integer no larger than max. */
    private static int arrayIndex(String token, int max) {
        if (token.isEmpty() || (token.length() > 1 && token.charAt(0) == '0')) return -1;
        for (int i = 0; i < token.length(); i++) {
            if (!Character.isDigit(token.charAt(i))) return -1;
        }
        try {
            int i = Integer.parseInt(token);
            return i <= max ? i : -1;
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
