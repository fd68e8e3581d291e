package com.temperamentplatform.common.threshold;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Breakdown of one flag threshold for one subject.
 *
 * @param finalThreshold pattern strength a flag must reach, in [0.1, 1.0]
 * @param sensitivity    {@code 1 - finalThreshold}
 */
public record ThresholdResult(
    @JsonProperty("baseThreshold")  double baseThreshold,
    @JsonProperty("ageModifier")    double ageModifier,
    @JsonProperty("stressModifier") double stressModifier,
    @JsonProperty("bondModifier")   double bondModifier,
    @JsonProperty("finalThreshold") double finalThreshold,
    @JsonProperty("sensitivity")    double sensitivity
) {}
