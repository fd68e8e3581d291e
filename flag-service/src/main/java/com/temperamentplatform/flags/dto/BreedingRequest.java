package com.temperamentplatform.flags.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record BreedingRequest(
    @JsonProperty("damId")             long damId,
    @JsonProperty("sireId")            long sireId,
    @JsonProperty("baseProbabilities") Map<String, Double> baseProbabilities
) {

    public BreedingRequest {
        baseProbabilities = baseProbabilities == null ? Map.of() : baseProbabilities;
    }
}
