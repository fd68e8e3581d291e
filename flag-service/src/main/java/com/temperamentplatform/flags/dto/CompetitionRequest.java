package com.temperamentplatform.flags.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.temperamentplatform.common.model.Discipline;

public record CompetitionRequest(
    @JsonProperty("discipline") Discipline discipline,
    @JsonProperty("baseScore")  double baseScore
) {}
