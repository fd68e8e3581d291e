package com.temperamentplatform.flags.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.temperamentplatform.common.model.FlagValence;

import java.util.List;

public record FlagDefinitionSummary(
    @JsonProperty("name")            String name,
    @JsonProperty("displayName")     String displayName,
    @JsonProperty("valence")         FlagValence valence,
    @JsonProperty("baseThreshold")   double baseThreshold,
    @JsonProperty("conflictsWith")   List<String> conflictsWith,
    @JsonProperty("specializedRule") boolean specializedRule
) {}
