package com.chronicle.engine;

import com.chronicle.model.EntityRef;

/**
 * Thrown when a resolution names an encounter or event the rules source does not know.
 */
public final class EntityNotFoundException extends RuntimeException {

    private final EntityRef entity;

    public EntityNotFoundException(EntityRef entity) {
        super(String.format("%s with ID %s not found", display(entity), entity.entityId()));
        this.entity = entity;
    }

    public EntityRef getEntity() {
        return entity;
    }

    private static String display(EntityRef entity) {
        String name = entity.entityType().name();
        return name.charAt(0) + name.substring(1).toLowerCase();
    }
}
