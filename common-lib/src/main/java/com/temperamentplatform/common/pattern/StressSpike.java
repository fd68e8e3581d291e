package com.temperamentplatform.common.pattern;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record StressSpike(
    @JsonProperty("occurredAt")   Instant occurredAt,
    @JsonProperty("stressDelta")  int stressDelta,
    @JsonProperty("taskCategory") String taskCategory
) {}
