package com.chronicle.resolution;

import com.chronicle.model.EntitySnapshot;

/**
 * The caller-owned step that marks an entity resolved, run between the PRE and ON_RESOLVE phases.
 * Receives the snapshot produced by PRE and returns the snapshot ON_RESOLVE starts from.
 */
@FunctionalInterface
public interface ResolutionAction {

    /**
     * @throws ResolutionActionException when the entity cannot be resolved
     */
    EntitySnapshot apply(EntitySnapshot entity);
}
