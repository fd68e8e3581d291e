package com.temperamentplatform.common.effect;

import com.fasterxml.jackson.annotation.JsonProperty;

public record StressModifiers(
    @JsonProperty("stressReduction")  double stressReduction,
    @JsonProperty("stressIncrease")   double stressIncrease,
    @JsonProperty("stressResistance") double stressResistance
) {

    public static final StressModifiers NONE = new StressModifiers(0, 0, 0);

    StressModifiers scaled(double factor) {
        return new StressModifiers(stressReduction * factor, stressIncrease * factor, stressResistance * factor);
    }
}
