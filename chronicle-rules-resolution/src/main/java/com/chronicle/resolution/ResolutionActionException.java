package com.chronicle.resolution;

import com.chronicle.model.EntityRef;

/**
 * Thrown when the core resolution action refuses or fails. This is the only failure that stops a resolution:
 * ON_RESOLVE and POST effects do not run after it.
 */
public class ResolutionActionException extends RuntimeException {

    private final EntityRef entity;

    public ResolutionActionException(EntityRef entity, String message) {
        super(message);
        this.entity = entity;
    }

    public ResolutionActionException(EntityRef entity, String message, Throwable cause) {
        super(message, cause);
        this.entity = entity;
    }

    public EntityRef getEntity() {
        return entity;
    }
}
