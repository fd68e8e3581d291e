package com.temperamentplatform.common.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.temperamentplatform.common.assignment.AssignmentDecision;
import com.temperamentplatform.common.conflict.ConflictResolution;
import com.temperamentplatform.common.pattern.PatternMetrics;
import com.temperamentplatform.common.trigger.TriggerVerdict;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything one pipeline run produced for one subject.
 *
 * @param unknownFlags held flags without a definition; ignored by evaluation
 */
public record EvaluationOutcome(
    @JsonProperty("subjectId")    long subjectId,
    @JsonProperty("status")       EvaluationStatus status,
    @JsonProperty("metrics")      PatternMetrics metrics,
    @JsonProperty("verdicts")     Map<String, TriggerVerdict> verdicts,
    @JsonProperty("decision")     AssignmentDecision decision,
    @JsonProperty("conflicts")    ConflictResolution conflicts,
    @JsonProperty("unknownFlags") List<String> unknownFlags
) {

    public EvaluationOutcome {
        verdicts = Collections.unmodifiableMap(new LinkedHashMap<>(verdicts));
        unknownFlags = List.copyOf(unknownFlags);
    }

    public List<String> newFlags() {
        return decision.newFlags();
    }

    public boolean skipped() {
        return status != EvaluationStatus.EVALUATED;
    }
}
