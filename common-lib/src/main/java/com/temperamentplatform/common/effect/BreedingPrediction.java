package com.temperamentplatform.common.effect;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.temperamentplatform.common.conflict.ConflictResolution;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * @param traitProbabilities adjusted probabilities, each in [0,1]
 * @param inheritedTraits    traits selected by rolling against {@code traitProbabilities}
 */
public record BreedingPrediction(
    @JsonProperty("baseProbabilities")  Map<String, Double> baseProbabilities,
    @JsonProperty("traitProbabilities") Map<String, Double> traitProbabilities,
    @JsonProperty("parentConflicts")    ConflictResolution parentConflicts,
    @JsonProperty("inheritedTraits")    List<String> inheritedTraits
) {

    public BreedingPrediction {
        baseProbabilities = Collections.unmodifiableMap(new LinkedHashMap<>(baseProbabilities));
        traitProbabilities = Collections.unmodifiableMap(new LinkedHashMap<>(traitProbabilities));
        inheritedTraits = List.copyOf(inheritedTraits);
    }
}
