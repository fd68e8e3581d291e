package com.temperamentplatform.common.pattern;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Weighted care-risk assessment. Every factor is in {@code [0, 1]}, higher is riskier.
 *
 * @param recommendations one line per factor above the recommendation threshold, or a
 *                        single all-clear line when none is
 */
public record CareRisk(
    @JsonProperty("overallRisk")            double overallRisk,
    @JsonProperty("level")                  RiskLevel level,
    @JsonProperty("consistencyRisk")        double consistencyRisk,
    @JsonProperty("qualityRisk")            double qualityRisk,
    @JsonProperty("frequencyRisk")          double frequencyRisk,
    @JsonProperty("caregiverStabilityRisk") double caregiverStabilityRisk,
    @JsonProperty("stressRisk")             double stressRisk,
    @JsonProperty("recommendations")        List<String> recommendations
) {

    public CareRisk {
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
