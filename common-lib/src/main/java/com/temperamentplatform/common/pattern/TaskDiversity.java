package com.temperamentplatform.common.pattern;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.temperamentplatform.common.model.QualityGrade;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Variety of caregiving tasks and spread of interaction quality.
 */
public record TaskDiversity(
    @JsonProperty("diversityScore")      double diversityScore,
    @JsonProperty("distinctTasks")       int distinctTasks,
    @JsonProperty("excellentRatio")      double excellentRatio,
    @JsonProperty("qualityDistribution") Map<QualityGrade, Integer> qualityDistribution
) {

    public TaskDiversity {
        qualityDistribution = qualityDistribution == null || qualityDistribution.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(qualityDistribution));
    }
}
