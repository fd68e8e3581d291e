package com.temperamentplatform.scheduler.strategy;

import com.temperamentplatform.common.model.PopulationEvaluationSummary;

import java.time.Duration;

/**
 * Picks the delay before the next population evaluation.
 *
 * <ul>
 *   <li>run completed, at least one subject evaluated or skipped: regular period</li>
 *   <li>run completed, every requested subject failed: retry interval</li>
 *   <li>call to the flag service failed: retry interval</li>
 * </ul>
 *
 * The retry interval is capped at the period, so a failing flag service is never
 * polled less often than a healthy one.
 */
public final class EvaluationTempoStrategy {

    public static final Duration DEFAULT_PERIOD         = Duration.ofDays(7);
    public static final Duration DEFAULT_RETRY_INTERVAL = Duration.ofHours(1);

    private final Duration period;
    private final Duration retryInterval;

    public EvaluationTempoStrategy(Duration period, Duration retryInterval) {
        if (period.isNegative() || period.isZero()) {
            throw new IllegalArgumentException("Evaluation period must be positive: " + period);
        }
        this.period = period;
        this.retryInterval = retryInterval.compareTo(period) > 0 ? period : retryInterval;
    }

    public Duration period() {
        return period;
    }

    public Duration resolve(PopulationEvaluationSummary summary) {
        boolean allFailed = summary.requested() > 0 && summary.errors().size() >= summary.requested();
        return allFailed ? retryInterval : period;
    }

    public Duration afterFailure() {
        return retryInterval;
    }
}
