package com.temperamentplatform.scheduler.strategy;

import com.temperamentplatform.common.model.EvaluationError;
import com.temperamentplatform.common.model.PopulationEvaluationSummary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EvaluationTempoStrategyTest {

    private final EvaluationTempoStrategy tempo =
        new EvaluationTempoStrategy(Duration.ofDays(7), Duration.ofHours(1));

    @Test
    @DisplayName("healthy run waits a full period")
    void healthyRun() {
        PopulationEvaluationSummary summary = new PopulationEvaluationSummary("t", 3, 2, 1, 0,
            List.of(new EvaluationError(9L, "boom")));
        assertEquals(Duration.ofDays(7), tempo.resolve(summary));
    }

    @Test
    @DisplayName("run where every subject failed retries sooner")
    void allFailed() {
        PopulationEvaluationSummary summary = new PopulationEvaluationSummary("t", 1, 0, 0, 0,
            List.of(new EvaluationError(9L, "boom")));
        assertEquals(Duration.ofHours(1), tempo.resolve(summary));
    }

    @Test
    @DisplayName("empty population is a healthy run")
    void emptyPopulation() {
        assertEquals(Duration.ofDays(7),
            tempo.resolve(new PopulationEvaluationSummary("t", 0, 0, 0, 0, List.of())));
    }

    @Test
    @DisplayName("retry interval is capped at the period")
    void retryCapped() {
        EvaluationTempoStrategy shortPeriod = new EvaluationTempoStrategy(Duration.ofMinutes(10), Duration.ofHours(1));
        assertEquals(Duration.ofMinutes(10), shortPeriod.afterFailure());
    }

    @Test
    @DisplayName("non-positive period is rejected")
    void invalidPeriod() {
        assertThrows(IllegalArgumentException.class,
            () -> new EvaluationTempoStrategy(Duration.ZERO, Duration.ofHours(1)));
    }
}
