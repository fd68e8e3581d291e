package com.temperamentplatform.common.pattern;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Everything the trigger rules know about a subject's recent care history.
 *
 * <p>Recomputed from scratch on every evaluation and never persisted.
 */
public record PatternMetrics(
    @JsonProperty("window")                   AnalysisWindow window,
    @JsonProperty("interactionCount")         int interactionCount,
    @JsonProperty("consistency")              CareConsistency consistency,
    @JsonProperty("bond")                     BondPattern bond,
    @JsonProperty("stress")                   StressPattern stress,
    @JsonProperty("qualityTrend")             Trend qualityTrend,
    @JsonProperty("taskDiversity")            TaskDiversity taskDiversity,
    @JsonProperty("caregiverStability")       CaregiverStability caregiverStability,
    @JsonProperty("neglect")                  NeglectPattern neglect,
    @JsonProperty("criticalPeriods")          List<CriticalPeriod> criticalPeriods,
    @JsonProperty("consistencyBreakdown")     ConsistencyBreakdown consistencyBreakdown,
    @JsonProperty("careRisk")                 CareRisk careRisk,
    @JsonProperty("caregiverEffectiveness")   List<CaregiverEffectiveness> caregiverEffectiveness
) {

    public PatternMetrics {
        criticalPeriods = criticalPeriods == null ? List.of() : List.copyOf(criticalPeriods);
        caregiverEffectiveness = caregiverEffectiveness == null ? List.of() : List.copyOf(caregiverEffectiveness);
    }

    public boolean hasCriticalPeriod(CriticalPeriodType type) {
        return criticalPeriods.stream().anyMatch(p -> p.type() == type);
    }
}
