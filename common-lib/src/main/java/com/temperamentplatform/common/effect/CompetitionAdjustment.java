package com.temperamentplatform.common.effect;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.temperamentplatform.common.model.Discipline;

public record CompetitionAdjustment(
    @JsonProperty("discipline")       Discipline discipline,
    @JsonProperty("baseScore")        double baseScore,
    @JsonProperty("bonus")            double bonus,
    @JsonProperty("penalty")          double penalty,
    @JsonProperty("stressResistance") double stressResistanceBonus,
    @JsonProperty("modifiedScore")    double modifiedScore
) {}
