package com.chronicle.engine.load;

import com.chronicle.model.Condition;
import com.chronicle.model.Effect;
import com.chronicle.model.EntityRef;
import com.chronicle.model.EntitySnapshot;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/**
 * Rules held in memory per {@code campaignId:branchId}. Lookups by id search branches in registration order
 * and return the first match.
 */
public final class InMemoryRulesSource implements RulesSource {

    private final Map<String, CampaignRules> branches = new ConcurrentHashMap<>();
    private final List<String> order = new CopyOnWriteArrayList<>();

    public InMemoryRulesSource put(String campaignId, String branchId, CampaignRules rules) {
        String key = Objects.requireNonNull(campaignId, "campaignId") + ":" + Objects.requireNonNull(branchId, "branchId");
        if (branches.put(key, Objects.requireNonNull(rules, "rules")) == null) order.add(key);
        return this;
    }

    public InMemoryRulesSource put(String campaignId, String branchId, List<Condition> conditions, List<Effect> effects,
                                   List<EntitySnapshot> entities) {
        return put(campaignId, branchId, new CampaignRules(conditions, effects, entities, null));
    }

    @Override
    public CampaignRules load(String campaignId, String branchId) {
        CampaignRules rules = branches.get(campaignId + ":" + branchId);
        return rules != null ? rules : CampaignRules.empty();
    }

    @Override
    public Optional<Condition> findCondition(String conditionId) {
        for (String key : order) {
            Condition c = branches.get(key).findCondition(conditionId);
            if (c != null) return Optional.of(c);
        }
        return Optional.empty();
    }

    @Override
    public Optional<CampaignRules> findRulesForEntity(EntityRef ref) {
        return firstMatching(rules -> rules.findEntity(ref) != null);
    }

    @Override
    public Optional<CampaignRules> findRulesForEffect(String effectId) {
        return firstMatching(rules -> rules.findEffect(effectId) != null);
    }

    private Optional<CampaignRules> firstMatching(Predicate<CampaignRules> test) {
        for (String key : order) {
            CampaignRules rules = branches.get(key);
            if (test.test(rules)) return Optional.of(rules);
        }
        return Optional.empty();
    }
}
