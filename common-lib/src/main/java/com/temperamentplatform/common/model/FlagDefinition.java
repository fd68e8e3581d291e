package com.temperamentplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Set;

/**
 * Static configuration of one behavioral flag.
 *
 * <p>The trigger rule is not part of the definition; it is looked up by {@link #name()}
 * in the {@code TriggerRuleRegistry}, which falls back to a valence-driven rule.
 *
 * @param baseThreshold pattern-strength threshold before age/stress/bond modifiers
 * @param conflictsWith names of flags that may never coexist with this one
 */
public record FlagDefinition(
    @JsonProperty("name")          String name,
    @JsonProperty("displayName")   String displayName,
    @JsonProperty("valence")       FlagValence valence,
    @JsonProperty("baseThreshold") double baseThreshold,
    @JsonProperty("conflictsWith") Set<String> conflictsWith,
    @JsonProperty("effects")       EffectProfile effects
) {

    public static final double DEFAULT_BASE_THRESHOLD = 0.5;

    public FlagDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Flag definition requires a name");
        }
        if (valence == null) {
            throw new IllegalArgumentException("Flag definition '" + name + "' requires a valence");
        }
        conflictsWith = conflictsWith == null ? Set.of() : Set.copyOf(conflictsWith);
        effects = effects == null ? EffectProfile.NONE : effects;
    }

    public boolean isPositive() {
        return valence == FlagValence.POSITIVE;
    }
}
