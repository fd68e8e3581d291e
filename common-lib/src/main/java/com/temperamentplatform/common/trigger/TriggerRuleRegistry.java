package com.temperamentplatform.common.trigger;

import com.temperamentplatform.common.registry.DefaultFlagDefinitions;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Maps flag names to their {@link TriggerPredicate}. Flags without an entry resolve to
 * {@link GenericTriggerRule}.
 */
public final class TriggerRuleRegistry {

    private final Map<String, TriggerPredicate> rules;

    private TriggerRuleRegistry(Map<String, TriggerPredicate> rules) {
        this.rules = Collections.unmodifiableMap(new HashMap<>(rules));
    }

    public static TriggerRuleRegistry of(Map<String, TriggerPredicate> rules) {
        return new TriggerRuleRegistry(rules);
    }

    public static TriggerRuleRegistry empty() {
        return new TriggerRuleRegistry(Map.of());
    }

    public static TriggerRuleRegistry standard() {
        Map<String, TriggerPredicate> rules = new HashMap<>();
        rules.put(DefaultFlagDefinitions.BRAVE, SpecializedTriggerRules::brave);
        rules.put(DefaultFlagDefinitions.AFFECTIONATE, SpecializedTriggerRules::affectionate);
        rules.put(DefaultFlagDefinitions.CONFIDENT, SpecializedTriggerRules::confident);
        rules.put(DefaultFlagDefinitions.CALM, SpecializedTriggerRules::calm);
        rules.put(DefaultFlagDefinitions.RESILIENT, SpecializedTriggerRules::resilient);
        rules.put(DefaultFlagDefinitions.SOCIAL, SpecializedTriggerRules::social);
        rules.put(DefaultFlagDefinitions.FEARFUL, SpecializedTriggerRules::fearful);
        rules.put(DefaultFlagDefinitions.INSECURE, SpecializedTriggerRules::insecure);
        rules.put(DefaultFlagDefinitions.ANTISOCIAL, SpecializedTriggerRules::antisocial);
        rules.put(DefaultFlagDefinitions.FRAGILE, SpecializedTriggerRules::fragile);
        return new TriggerRuleRegistry(rules);
    }

    /** Returns a copy with {@code predicate} registered for {@code flagName}. */
    public TriggerRuleRegistry with(String flagName, TriggerPredicate predicate) {
        Map<String, TriggerPredicate> copy = new HashMap<>(rules);
        copy.put(flagName, predicate);
        return new TriggerRuleRegistry(copy);
    }

    public TriggerPredicate ruleFor(String flagName) {
        return rules.getOrDefault(flagName, GenericTriggerRule.INSTANCE);
    }

    public boolean hasSpecializedRule(String flagName) {
        return rules.containsKey(flagName);
    }
}
