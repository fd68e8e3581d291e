package com.temperamentplatform.common.pattern;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Summary of bond deltas over the window.
 *
 * @param positiveRatio fraction of interactions with a strictly positive bond delta
 */
public record BondPattern(
    @JsonProperty("trend")         Trend trend,
    @JsonProperty("averageChange") double averageChange,
    @JsonProperty("totalChange")   int totalChange,
    @JsonProperty("positiveRatio") double positiveRatio
) {}
