package com.temperamentplatform.common.pattern;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Care-free days over the window.
 *
 * @param extendedPeriods maximal runs of at least five consecutive care-free days
 */
public record NeglectPattern(
    @JsonProperty("neglectRatio")       double neglectRatio,
    @JsonProperty("neglected")          boolean neglected,
    @JsonProperty("severity")           NeglectSeverity severity,
    @JsonProperty("daysWithoutCare")    int daysWithoutCare,
    @JsonProperty("extendedPeriods")    List<CareGap> extendedPeriods,
    @JsonProperty("longestNeglectDays") int longestNeglectDays
) {

    public NeglectPattern {
        extendedPeriods = extendedPeriods == null ? List.of() : List.copyOf(extendedPeriods);
    }
}
