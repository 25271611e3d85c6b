package com.chronicle.engine.load;

import com.chronicle.model.Condition;
import com.chronicle.model.Effect;
import com.chronicle.model.EntityRef;
import com.chronicle.model.EntitySnapshot;

import java.util.List;

/**
 * Conditions, effects and entity snapshots of one campaign branch, plus warnings for records that could not be read.
 */
public record CampaignRules(List<Condition> conditions, List<Effect> effects, List<EntitySnapshot> entities,
                            List<String> warnings) {

    public CampaignRules {
        conditions = conditions != null ? List.copyOf(conditions) : List.of();
        effects = effects != null ? List.copyOf(effects) : List.of();
        entities = entities != null ? List.copyOf(entities) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public static CampaignRules empty() {
        return new CampaignRules(null, null, null, null);
    }

    public List<EntityRef> entityRefs() {
        return entities.stream().map(EntitySnapshot::getRef).toList();
    }

    public Condition findCondition(String conditionId) {
        for (Condition c : conditions) {
            if (c.getId().equals(conditionId)) return c;
        }
        return null;
    }

    public Effect findEffect(String effectId) {
        for (Effect e : effects) {
            if (e.getId().equals(effectId)) return e;
        }
        return null;
    }

    public EntitySnapshot findEntity(EntityRef ref) {
        for (EntitySnapshot e : entities) {
            if (e.getRef().equals(ref)) return e;
        }
        return null;
    }

    /** Effects owned by the entity or by its whole type. */
    public List<Effect> effectsFor(EntityRef ref) {
        return effects.stream().filter(e -> e.appliesTo(ref)).toList();
    }
}
