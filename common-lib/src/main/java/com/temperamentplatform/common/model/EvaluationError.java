package com.temperamentplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One subject that failed during a population evaluation run.
 */
public record EvaluationError(
    @JsonProperty("subjectId") long subjectId,
    @JsonProperty("message")   String message
) {}
