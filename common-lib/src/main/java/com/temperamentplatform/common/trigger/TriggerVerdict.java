package com.temperamentplatform.common.trigger;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of evaluating one flag for one subject.
 *
 * @param conditions rule sub-conditions in evaluation order, followed by {@code patternStrength}
 * @param strength   valence pattern strength
 * @param threshold  final threshold the strength was compared against
 */
public record TriggerVerdict(
    @JsonProperty("flagName")   String flagName,
    @JsonProperty("triggered")  boolean triggered,
    @JsonProperty("reason")     String reason,
    @JsonProperty("conditions") Map<String, Boolean> conditions,
    @JsonProperty("strength")   double strength,
    @JsonProperty("threshold")  double threshold
) {

    public static final String EVALUATION_ERROR = "Evaluation error";

    public TriggerVerdict {
        conditions = conditions == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(conditions));
    }

    public static TriggerVerdict error(String flagName, double threshold) {
        return new TriggerVerdict(flagName, false, EVALUATION_ERROR, Map.of(), 0.0, threshold);
    }
}
