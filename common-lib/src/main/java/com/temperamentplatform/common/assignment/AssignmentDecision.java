package com.temperamentplatform.common.assignment;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.temperamentplatform.common.trigger.TriggerVerdict;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Flags to append to a subject, with the evidence behind each decision.
 *
 * @param newFlags       flags to append, in definition order
 * @param evidence       verdict for every accepted flag
 * @param skipped        reason for every flag that was considered and not accepted
 * @param resultingFlags current flags followed by {@code newFlags}
 */
public record AssignmentDecision(
    @JsonProperty("newFlags")       List<String> newFlags,
    @JsonProperty("evidence")       Map<String, TriggerVerdict> evidence,
    @JsonProperty("skipped")        Map<String, SkipReason> skipped,
    @JsonProperty("resultingFlags") Set<String> resultingFlags
) {

    public AssignmentDecision {
        newFlags = List.copyOf(newFlags);
        evidence = Collections.unmodifiableMap(new LinkedHashMap<>(evidence));
        skipped = Collections.unmodifiableMap(new LinkedHashMap<>(skipped));
        resultingFlags = Collections.unmodifiableSet(new LinkedHashSet<>(resultingFlags));
    }

    public boolean hasChanges() {
        return !newFlags.isEmpty();
    }
}
