package com.chronicle.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Reference to one entity instance, or to every instance of a type when {@code entityId} is null.
 */
public record EntityRef(
        @JsonProperty("entityType") EntityType entityType,
        @JsonProperty("entityId") String entityId
) {

    /** Id segment used for type-level references. */
    public static final String ANY_INSTANCE = "*";

    @JsonCreator
    public EntityRef {
        Objects.requireNonNull(entityType, "entityType");
        entityId = entityId != null && !entityId.isBlank() ? entityId.trim() : null;
    }

    public static EntityRef of(EntityType entityType, String entityId) {
        return new EntityRef(entityType, entityId);
    }

    public static EntityRef typeLevel(EntityType entityType) {
        return new EntityRef(entityType, null);
    }

    /** True when this reference applies to all instances of {@link #entityType()}. */
    public boolean isTypeLevel() {
        return entityId == null;
    }

    /** Whether this reference covers the given concrete instance. */
    public boolean covers(EntityRef instance) {
        if (instance == null || instance.entityType != entityType) return false;
        return isTypeLevel() || entityId.equals(instance.entityId);
    }

    /** Stable key, e.g. {@code SETTLEMENT:s-1} or {@code SETTLEMENT:*}. */
    public String key() {
        return entityType.name() + ":" + (entityId != null ? entityId : ANY_INSTANCE);
    }

    @Override
    public String toString() {
        return key();
    }
}
