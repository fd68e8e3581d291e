package com.temperamentplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Immutable record of one caregiving interaction with a subject.
 *
 * <p>Created by external caregiving actions and never mutated. {@code bondDelta} and
 * {@code stressDelta} are signed; a negative stress delta means the interaction calmed
 * the subject.
 */
public record InteractionEvent(
    @JsonProperty("subjectId")            long subjectId,
    @JsonProperty("caregiverId")          long caregiverId,
    @JsonProperty("caregiverPersonality") String caregiverPersonality,
    @JsonProperty("occurredAt")           Instant occurredAt,
    @JsonProperty("taskCategory")         String taskCategory,
    @JsonProperty("quality")              QualityGrade quality,
    @JsonProperty("bondDelta")            int bondDelta,
    @JsonProperty("stressDelta")          int stressDelta,
    @JsonProperty("durationMinutes")      int durationMinutes
) {}
