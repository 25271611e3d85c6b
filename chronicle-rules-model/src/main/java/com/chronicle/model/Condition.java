package com.chronicle.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * A named expression attached to an entity (or to every instance of a type when {@code entityId} is null).
 * Read-only to the engine; inactive conditions are never evaluated and never appear in the dependency graph.
 */
public final class Condition {

    private final String id;
    private final EntityType entityType;
    private final String entityId;
    private final String field;
    private final JsonNode expression;
    private final String description;
    private final int priority;
    private final boolean active;
    private final int version;

    @JsonCreator
    public Condition(
            @JsonProperty("id") String id,
            @JsonProperty("entityType") EntityType entityType,
            @JsonProperty("entityId") String entityId,
            @JsonProperty("field") String field,
            @JsonProperty("expression") JsonNode expression,
            @JsonProperty("description") String description,
            @JsonProperty("priority") Integer priority,
            @JsonProperty("isActive") Boolean active,
            @JsonProperty("version") Integer version) {
        this.id = Objects.requireNonNull(id, "id");
        this.entityType = Objects.requireNonNull(entityType, "entityType");
        this.entityId = entityId != null && !entityId.isBlank() ? entityId : null;
        this.field = field;
        this.expression = expression;
        this.description = description;
        this.priority = priority != null ? priority : 0;
        this.active = active == null || active;
        this.version = version != null ? version : 1;
    }

    public String getId() {
        return id;
    }

    public EntityType getEntityType() {
        return entityType;
    }

    /** Owning instance id, or null for a type-level condition. */
    public String getEntityId() {
        return entityId;
    }

    @JsonIgnore
    public EntityRef getOwner() {
        return new EntityRef(entityType, entityId);
    }

    public String getField() {
        return field;
    }

    /** Raw expression tree; may be null or malformed in records that came from storage. */
    public JsonNode getExpression() {
        return expression;
    }

    public String getDescription() {
        return description;
    }

    public int getPriority() {
        return priority;
    }

    @JsonProperty("isActive")
    public boolean isActive() {
        return active;
    }

    public int getVersion() {
        return version;
    }

    @Override
    public String toString() {
        return "Condition{" + id + ", " + getOwner() + ", field=" + field + "}";
    }
}
