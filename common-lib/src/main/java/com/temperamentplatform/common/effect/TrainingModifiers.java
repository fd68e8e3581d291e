package com.temperamentplatform.common.effect;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TrainingModifiers(
    @JsonProperty("effectiveness") double effectiveness,
    @JsonProperty("adaptability")  double adaptability
) {

    public static final TrainingModifiers NONE = new TrainingModifiers(0, 0);

    TrainingModifiers scaled(double factor) {
        return new TrainingModifiers(effectiveness * factor, adaptability * factor);
    }
}
