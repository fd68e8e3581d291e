package com.temperamentplatform.common.pipeline;

public enum EvaluationStatus {
    /** Triggers were evaluated; the decision may still be empty. */
    EVALUATED,
    /** Subject is past the maturity cutoff; no flags can be added. */
    PAST_MATURITY,
    /** Subject already holds the maximum number of flags. */
    AT_CAPACITY
}
