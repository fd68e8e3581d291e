package com.temperamentplatform.flags.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.temperamentplatform.common.assignment.SkipReason;
import com.temperamentplatform.common.conflict.ConflictResolution;
import com.temperamentplatform.common.pipeline.EvaluationOutcome;
import com.temperamentplatform.common.pipeline.EvaluationStatus;
import com.temperamentplatform.common.trigger.TriggerVerdict;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Result of evaluating one subject, as returned by the API.
 *
 * @param flags    the subject's flags after any append
 * @param evidence verdict behind every newly assigned flag
 */
public record SubjectEvaluationResult(
    @JsonProperty("subjectId")    long subjectId,
    @JsonProperty("status")       EvaluationStatus status,
    @JsonProperty("evaluatedAt")  Instant evaluatedAt,
    @JsonProperty("newFlags")     List<String> newFlags,
    @JsonProperty("flags")        Set<String> flags,
    @JsonProperty("evidence")     Map<String, TriggerVerdict> evidence,
    @JsonProperty("skipped")      Map<String, SkipReason> skipped,
    @JsonProperty("conflicts")    ConflictResolution conflicts,
    @JsonProperty("unknownFlags") List<String> unknownFlags
) {

    public static SubjectEvaluationResult of(EvaluationOutcome outcome, Set<String> storedFlags, Instant asOf) {
        return new SubjectEvaluationResult(
            outcome.subjectId(),
            outcome.status(),
            asOf,
            outcome.newFlags(),
            storedFlags,
            outcome.decision().evidence(),
            outcome.decision().skipped(),
            outcome.conflicts(),
            outcome.unknownFlags());
    }
}
