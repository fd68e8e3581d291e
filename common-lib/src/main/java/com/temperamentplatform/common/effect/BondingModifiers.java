package com.temperamentplatform.common.effect;

import com.fasterxml.jackson.annotation.JsonProperty;

public record BondingModifiers(
    @JsonProperty("bondingBonus")      double bondingBonus,
    @JsonProperty("bondingDifficulty") double bondingDifficulty,
    @JsonProperty("bondingSpeed")      double bondingSpeed
) {

    public static final BondingModifiers NONE = new BondingModifiers(0, 0, 0);

    BondingModifiers scaled(double factor) {
        return new BondingModifiers(bondingBonus * factor, bondingDifficulty * factor, bondingSpeed * factor);
    }
}
