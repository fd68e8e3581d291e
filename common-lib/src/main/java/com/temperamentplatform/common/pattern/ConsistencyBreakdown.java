package com.temperamentplatform.common.pattern;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Multi-factor care consistency. Every component is in {@code [0, 1]}, higher is steadier.
 *
 * @param overallScore weighted blend of the five components
 * @param frequency    regularity of the gaps between consecutive interactions
 * @param quality      spread of quality grades
 * @param duration     spread of interaction durations
 * @param caregiver    how few distinct caregivers were involved
 * @param timing       spread of the UTC hour of day
 * @param dataPoints   interactions the breakdown was computed from
 */
public record ConsistencyBreakdown(
    @JsonProperty("overallScore") double overallScore,
    @JsonProperty("frequency")    double frequency,
    @JsonProperty("quality")      double quality,
    @JsonProperty("duration")     double duration,
    @JsonProperty("caregiver")    double caregiver,
    @JsonProperty("timing")       double timing,
    @JsonProperty("dataPoints")   int dataPoints
) {

    public static ConsistencyBreakdown empty() {
        return new ConsistencyBreakdown(0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0);
    }
}
