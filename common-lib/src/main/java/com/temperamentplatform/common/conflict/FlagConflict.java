package com.temperamentplatform.common.conflict;

import com.fasterxml.jackson.annotation.JsonProperty;

public record FlagConflict(
    @JsonProperty("first")    String first,
    @JsonProperty("second")   String second,
    @JsonProperty("severity") double severity
) {}
