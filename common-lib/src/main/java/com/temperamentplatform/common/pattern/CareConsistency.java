package com.temperamentplatform.common.pattern;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * How regularly a subject received care across the analysis window.
 *
 * @param consistencyScore   {@code careFrequency} discounted by the number of care gaps, in [0,1]
 * @param careFrequency      fraction of window days with at least one interaction
 * @param interactionsPerDay average interactions per window day
 */
public record CareConsistency(
    @JsonProperty("consistencyScore")   double consistencyScore,
    @JsonProperty("careFrequency")      double careFrequency,
    @JsonProperty("daysWithCare")       int daysWithCare,
    @JsonProperty("totalDays")          int totalDays,
    @JsonProperty("gaps")               List<CareGap> gaps,
    @JsonProperty("interactionsPerDay") double interactionsPerDay
) {

    public CareConsistency {
        gaps = gaps == null ? List.of() : List.copyOf(gaps);
    }

    public int gapCount() {
        return gaps.size();
    }
}
