package com.temperamentplatform.common.pattern;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * How well one caregiver's interactions with a subject went.
 *
 * @param effectivenessScore blend of normalised bond gain, stress relief and quality, in {@code [0, 1]}
 * @param averageQuality     mean ordinal quality score, {@code 1..4}
 */
public record CaregiverEffectiveness(
    @JsonProperty("caregiverId")          long caregiverId,
    @JsonProperty("caregiverPersonality") String caregiverPersonality,
    @JsonProperty("effectivenessScore")   double effectivenessScore,
    @JsonProperty("averageBondDelta")     double averageBondDelta,
    @JsonProperty("averageStressDelta")   double averageStressDelta,
    @JsonProperty("averageQuality")       double averageQuality,
    @JsonProperty("interactionCount")     int interactionCount
) {}
