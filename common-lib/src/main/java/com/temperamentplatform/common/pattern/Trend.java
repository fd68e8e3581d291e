package com.temperamentplatform.common.pattern;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.temperamentplatform.common.model.TrendDirection;

/**
 * Direction and least-squares slope of a numeric series taken over event order.
 */
public record Trend(
    @JsonProperty("direction") TrendDirection direction,
    @JsonProperty("slope")     double slope,
    @JsonProperty("points")    int points
) {

    public boolean is(TrendDirection expected) {
        return direction == expected;
    }
}
