package com.temperamentplatform.common.pattern;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param reassignments caregiver changes between consecutive interactions
 */
public record CaregiverStability(
    @JsonProperty("stabilityScore")     double stabilityScore,
    @JsonProperty("distinctCaregivers") int distinctCaregivers,
    @JsonProperty("reassignments")      int reassignments
) {}
