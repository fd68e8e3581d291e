package com.temperamentplatform.common.effect;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param personalityCompatibility raw caregiver compatibility multiplier, in [0.5, 1.5]
 * @param stressImpact             stress increase minus stress reduction
 * @param bondingImpact            bonding bonus minus bonding difficulty
 */
public record TrainingAdjustment(
    @JsonProperty("baseEffectiveness")        double baseEffectiveness,
    @JsonProperty("flagModifier")             double flagModifier,
    @JsonProperty("personalityCompatibility") double personalityCompatibility,
    @JsonProperty("modifiedEffectiveness")    double modifiedEffectiveness,
    @JsonProperty("stressImpact")             double stressImpact,
    @JsonProperty("bondingImpact")            double bondingImpact
) {}
