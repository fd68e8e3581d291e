package com.temperamentplatform.common.conflict;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * @param dampeningFactor multiplier applied to every aggregated effect; 1.0 when no conflicts
 */
public record ConflictResolution(
    @JsonProperty("conflicts")       List<FlagConflict> conflicts,
    @JsonProperty("method")          ResolutionMethod method,
    @JsonProperty("dampeningFactor") double dampeningFactor
) {

    public static final ConflictResolution NONE =
        new ConflictResolution(List.of(), ResolutionMethod.NONE_NEEDED, 1.0);

    public ConflictResolution {
        conflicts = List.copyOf(conflicts);
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }
}
