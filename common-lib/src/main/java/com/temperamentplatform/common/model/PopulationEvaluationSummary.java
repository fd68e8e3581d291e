package com.temperamentplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of one population evaluation run, shared between the flag service (producer)
 * and the scheduler (consumer).
 *
 * @param requested distinct subject ids in the run
 * @param evaluated subjects whose triggers were evaluated
 * @param assigned  total number of flags appended across all subjects
 * @param skipped   subjects past the maturity cutoff or already at capacity
 * @param errors    subjects that failed; the run continues past them
 */
public record PopulationEvaluationSummary(
    @JsonProperty("traceId")   String traceId,
    @JsonProperty("requested") int requested,
    @JsonProperty("evaluated") int evaluated,
    @JsonProperty("assigned")  int assigned,
    @JsonProperty("skipped")   int skipped,
    @JsonProperty("errors")    List<EvaluationError> errors
) {

    public PopulationEvaluationSummary {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
