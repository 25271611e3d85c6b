package com.chronicle.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * An ordered patch payload applied to an entity's variables during one timing phase of a resolution.
 * An optional {@code conditionId} names a guard condition that must evaluate truthy for the effect to run.
 */
public final class Effect {

    private final String id;
    private final EntityType entityType;
    private final String entityId;
    private final EffectTiming timing;
    private final int priority;
    private final List<PatchOp> payload;
    private final String conditionId;
    private final boolean active;
    private final String description;

    @JsonCreator
    public Effect(
            @JsonProperty("id") String id,
            @JsonProperty("entityType") EntityType entityType,
            @JsonProperty("entityId") String entityId,
            @JsonProperty("timing") EffectTiming timing,
            @JsonProperty("priority") Integer priority,
            @JsonProperty("payload") List<PatchOp> payload,
            @JsonProperty("conditionId") String conditionId,
            @JsonProperty("isActive") Boolean active,
            @JsonProperty("description") String description) {
        this.id = Objects.requireNonNull(id, "id");
        this.entityType = Objects.requireNonNull(entityType, "entityType");
        this.entityId = entityId != null && !entityId.isBlank() ? entityId : null;
        this.timing = timing != null ? timing : EffectTiming.ON_RESOLVE;
        this.priority = priority != null ? priority : 0;
        this.payload = payload != null ? List.copyOf(payload) : List.of();
        this.conditionId = conditionId != null && !conditionId.isBlank() ? conditionId : null;
        this.active = active == null || active;
        this.description = description;
    }

    /** Convenience constructor for an active, unguarded effect. */
    public Effect(String id, EntityType entityType, String entityId, EffectTiming timing, int priority, List<PatchOp> payload) {
        this(id, entityType, entityId, timing, priority, payload, null, true, null);
    }

    public String getId() {
        return id;
    }

    public EntityType getEntityType() {
        return entityType;
    }

    public String getEntityId() {
        return entityId;
    }

    @JsonIgnore
    public EntityRef getOwner() {
        return new EntityRef(entityType, entityId);
    }

    /** Phase in which this effect runs. Defaults to ON_RESOLVE. */
    public EffectTiming getTiming() {
        return timing;
    }

    public int getPriority() {
        return priority;
    }

    public List<PatchOp> getPayload() {
        return payload;
    }

    /** Guard condition id, or null when the effect always runs. */
    public String getConditionId() {
        return conditionId;
    }

    @JsonProperty("isActive")
    public boolean isActive() {
        return active;
    }

    public String getDescription() {
        return description;
    }

    /** Whether this effect belongs to the given entity instance (type-level effects apply to every instance). */
    public boolean appliesTo(EntityRef entity) {
        return getOwner().covers(entity);
    }

    @Override
    public String toString() {
        return "Effect{" + id + ", " + getOwner() + ", " + timing + ", priority=" + priority + "}";
    }
}
