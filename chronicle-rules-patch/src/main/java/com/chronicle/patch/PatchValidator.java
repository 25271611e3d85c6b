package com.chronicle.patch;

import com.chronicle.model.EntityType;
import com.chronicle.model.PatchOp;
import com.chronicle.model.PatchOpType;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks a patch payload without applying it. Stateless and thread-safe.
 * <p>
 * Errors: unsupported {@code op}; missing, non-string or relative {@code path}; missing {@code value} for
 * add/replace/test; missing or invalid {@code from} for move/copy; paths into protected fields (identity,
 * timestamps, the optimistic-lock version and per-type foreign keys).
 * Warnings: paths outside {@code /variables/}; unknown extra fields.
 */
public final class PatchValidator {

    /** Top-level fields no patch may target. */
    public static final Set<String> PROTECTED_FIELDS = Set.of("id", "createdAt", "updatedAt", "deletedAt", "version");

    private static final Map<EntityType, Set<String>> ENTITY_PROTECTED_FIELDS = new EnumMap<>(EntityType.class);

    static {
        ENTITY_PROTECTED_FIELDS.put(EntityType.SETTLEMENT, Set.of("campaignId", "kingdomId", "locationId"));
        ENTITY_PROTECTED_FIELDS.put(EntityType.STRUCTURE, Set.of("settlementId"));
        ENTITY_PROTECTED_FIELDS.put(EntityType.KINGDOM, Set.of("campaignId"));
        ENTITY_PROTECTED_FIELDS.put(EntityType.ENCOUNTER, Set.of("campaignId", "eventId"));
        ENTITY_PROTECTED_FIELDS.put(EntityType.EVENT, Set.of("campaignId", "encounterId"));
    }

    public ValidationResult validate(List<PatchOp> ops) {
        return validate(ops, null);
    }

    /**
     * @param entityType when non-null, the type's foreign-key fields are protected as well
     */
    public ValidationResult validate(List<PatchOp> ops, EntityType entityType) {
        if (ops == null) {
            return ValidationResult.failure("Patch must be an array of operations");
        }
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        for (int i = 0; i < ops.size(); i++) {
            validateOne(i, ops.get(i), entityType, errors, warnings);
        }
        return ValidationResult.of(errors, warnings);
    }

    private void validateOne(int i, PatchOp op, EntityType entityType, List<String> errors, List<String> warnings) {
        String at = "Operation " + i + ": ";
        if (op == null || !op.isObject()) {
            errors.add(at + "must be a JSON object");
            return;
        }
        String opName = op.getOp();
        PatchOpType type = op.getType();
        if (opName == null) {
            errors.add(at + "missing \"op\" field");
        } else if (type == null) {
            errors.add(at + "unsupported op \"" + opName + "\"");
        }

        if (!op.hasPath()) {
            errors.add(at + "missing \"path\" field");
        } else if (op.getPath() == null) {
            errors.add(at + "\"path\" must be a string");
        } else if (!JsonPointers.isValid(op.getPath())) {
            errors.add(at + "\"path\" must start with '/': " + op.getPath());
        } else {
            checkProtected(at, op.getPath(), entityType, errors);
            if (!JsonPointers.isVariablePath(op.getPath())) {
                warnings.add(at + "path " + op.getPath() + " is outside /variables/");
            }
        }

        if (type != null && type.requiresValue() && !op.hasValue()) {
            errors.add(at + "op \"" + type.wireName() + "\" requires a \"value\" field");
        }
        if (type != null && type.requiresFrom()) {
            if (!op.hasFrom()) {
                errors.add(at + "op \"" + type.wireName() + "\" requires a \"from\" field");
            } else if (!JsonPointers.isValid(op.getFrom())) {
                errors.add(at + "\"from\" must be a string starting with '/'");
            } else if (type == PatchOpType.MOVE) {
                checkProtected(at + "source ", op.getFrom(), entityType, errors);
            }
        }

        for (String extra : op.getUnknownFields()) {
            warnings.add(at + "unknown field \"" + extra + "\" ignored");
        }
    }

    private static void checkProtected(String at, String path, EntityType entityType, List<String> errors) {
        String top = JsonPointers.topLevelField(path);
        if (PROTECTED_FIELDS.contains(top)) {
            errors.add(at + "path " + path + " is not allowed: \"" + top + "\" is a protected field");
            return;
        }
        if (entityType != null && ENTITY_PROTECTED_FIELDS.getOrDefault(entityType, Set.of()).contains(top)) {
            errors.add(at + "path " + path + " is not allowed: \"" + top + "\" is a protected field for " + entityType);
        }
    }
}
