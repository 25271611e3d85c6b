package com.chronicle.engine.load;

import com.chronicle.model.Condition;
import com.chronicle.model.Effect;
import com.chronicle.model.EntityRef;
import com.chronicle.model.EntitySnapshot;

import java.util.List;
import java.util.Optional;

/**
 * Read-only access to persisted conditions, effects and entity snapshots. The engine never writes through it.
 * <p>
 * Cross-branch lookups return the whole {@link CampaignRules} of the branch that holds the record, so callers
 * resolve related records (an effect's guard condition, an entity's effects) within that same branch.
 */
public interface RulesSource {

    /** All records of one campaign branch; empty (never null) when the branch is unknown. */
    CampaignRules load(String campaignId, String branchId);

    Optional<Condition> findCondition(String conditionId);

    /** Records of the first branch holding the entity snapshot. */
    Optional<CampaignRules> findRulesForEntity(EntityRef ref);

    /** Records of the first branch holding the effect. */
    Optional<CampaignRules> findRulesForEffect(String effectId);

    default Optional<EntitySnapshot> findEntity(EntityRef ref) {
        return findRulesForEntity(ref).map(rules -> rules.findEntity(ref));
    }

    /** Effects owned by the entity or by its whole type, in stored order, from the branch holding the entity. */
    default List<Effect> findEffects(EntityRef ref) {
        return findRulesForEntity(ref).map(rules -> rules.effectsFor(ref)).orElse(List.of());
    }
}
