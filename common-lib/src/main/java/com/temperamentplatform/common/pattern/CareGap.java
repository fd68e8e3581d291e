package com.temperamentplatform.common.pattern;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A run of consecutive care-free days, as zero-based day indices within the analysis window.
 */
public record CareGap(
    @JsonProperty("startDay") int startDay,
    @JsonProperty("endDay")   int endDay
) {

    public int lengthDays() {
        return endDay - startDay + 1;
    }
}
