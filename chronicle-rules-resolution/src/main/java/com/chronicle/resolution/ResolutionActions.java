package com.chronicle.resolution;

import com.chronicle.model.EntitySnapshot;
import com.chronicle.model.EntityType;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Clock;
import java.util.Objects;

/**
 * Built-in core actions for encounters and events. Each sets a completion flag and timestamp on the entity
 * document and refuses an entity whose flag is already set.
 */
public final class ResolutionActions {

    public static final String ENCOUNTER_FLAG = "isResolved";
    public static final String ENCOUNTER_TIMESTAMP = "resolvedAt";
    public static final String EVENT_FLAG = "isCompleted";
    public static final String EVENT_TIMESTAMP = "occurredAt";

    private ResolutionActions() {
    }

    public static ResolutionAction markEncounterResolved() {
        return markEncounterResolved(Clock.systemUTC());
    }

    public static ResolutionAction markEncounterResolved(Clock clock) {
        return markFlag(EntityType.ENCOUNTER, ENCOUNTER_FLAG, ENCOUNTER_TIMESTAMP, "already resolved", clock);
    }

    public static ResolutionAction markEventCompleted() {
        return markEventCompleted(Clock.systemUTC());
    }

    public static ResolutionAction markEventCompleted(Clock clock) {
        return markFlag(EntityType.EVENT, EVENT_FLAG, EVENT_TIMESTAMP, "already completed", clock);
    }

    static ResolutionAction markFlag(EntityType expectedType, String flag, String timestampField, String refusal, Clock clock) {
        Objects.requireNonNull(clock, "clock");
        return entity -> {
            if (entity.getRef().entityType() != expectedType) {
                throw new ResolutionActionException(entity.getRef(),
                        String.format("Expected %s but got %s", expectedType, entity.getRef()));
            }
            if (entity.flag(flag)) {
                throw new ResolutionActionException(entity.getRef(),
                        String.format("%s with ID %s is %s", display(expectedType), entity.getRef().entityId(), refusal));
            }
            ObjectNode doc = entity.getDocument();
            doc.put(flag, true);
            doc.put(timestampField, clock.instant().toString());
            return entity.withDocument(doc);
        };
    }

    private static String display(EntityType type) {
        String name = type.name();
        return name.charAt(0) + name.substring(1).toLowerCase();
    }
}
