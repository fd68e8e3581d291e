package com.temperamentplatform.common.pattern;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Two consecutive interactions that together indicate an acute problem.
 *
 * @param startedAt timestamp of the first interaction of the pair
 * @param endedAt   timestamp of the second interaction of the pair
 */
public record CriticalPeriod(
    @JsonProperty("type")      CriticalPeriodType type,
    @JsonProperty("startedAt") Instant startedAt,
    @JsonProperty("endedAt")   Instant endedAt
) {}
