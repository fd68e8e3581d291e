package com.temperamentplatform.flags.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param caregiverPersonality optional; {@code calm}, {@code energetic} or {@code methodical}
 */
public record TrainingRequest(
    @JsonProperty("baseEffectiveness")    double baseEffectiveness,
    @JsonProperty("caregiverPersonality") String caregiverPersonality
) {}
