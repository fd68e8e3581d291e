package com.temperamentplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Read-only snapshot of a simulated animal as seen by the flag pipeline.
 *
 * <p>{@code flags} keeps set semantics (no duplicates); insertion order is kept only so
 * that logs and API output are stable. The snapshot never changes; appending flags
 * produces a new instance via {@link #withAppendedFlags(List)}.
 */
public record SubjectState(
    @JsonProperty("id")          long id,
    @JsonProperty("name")        String name,
    @JsonProperty("birthDate")   Instant birthDate,
    @JsonProperty("bondScore")   int bondScore,
    @JsonProperty("stressLevel") int stressLevel,
    @JsonProperty("flags")       Set<String> flags
) {

    /** Hard cap on the number of flags a subject may ever hold. */
    public static final int MAX_FLAGS = 5;

    public SubjectState {
        flags = flags == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(flags));
    }

    /** Whole days elapsed since birth at {@code asOf}; never negative. */
    public long ageInDays(Instant asOf) {
        if (birthDate == null || asOf.isBefore(birthDate)) return 0;
        return Duration.between(birthDate, asOf).toDays();
    }

    public boolean hasFlag(String flagName) {
        return flags.contains(flagName);
    }

    public boolean atFlagCapacity() {
        return flags.size() >= MAX_FLAGS;
    }

    public SubjectState withAppendedFlags(List<String> newFlags) {
        Set<String> merged = new LinkedHashSet<>(flags);
        merged.addAll(newFlags);
        return new SubjectState(id, name, birthDate, bondScore, stressLevel, merged);
    }
}
