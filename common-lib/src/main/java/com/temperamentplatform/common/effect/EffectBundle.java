package com.temperamentplatform.common.effect;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.temperamentplatform.common.conflict.ConflictResolution;
import com.temperamentplatform.common.model.Discipline;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregated, already-dampened modifiers produced by a subject's active flags.
 *
 * <p>Every call to the aggregator builds a new bundle; nothing inside is shared with
 * the flag definitions or with other bundles.
 *
 * @param traitProbabilityDeltas breeding trait-probability deltas keyed by trait name
 * @param unknownFlags           held flags with no definition; contribute nothing
 */
public record EffectBundle(
    @JsonProperty("competitionBonuses")     Map<Discipline, Double> competitionBonuses,
    @JsonProperty("competitionPenalties")   Map<Discipline, Double> competitionPenalties,
    @JsonProperty("stress")                 StressModifiers stress,
    @JsonProperty("bonding")                BondingModifiers bonding,
    @JsonProperty("training")               TrainingModifiers training,
    @JsonProperty("traitProbabilityDeltas") Map<String, Double> traitProbabilityDeltas,
    @JsonProperty("activeFlags")            List<String> activeFlags,
    @JsonProperty("positiveFlagCount")      int positiveFlagCount,
    @JsonProperty("unknownFlags")           List<String> unknownFlags,
    @JsonProperty("conflictResolution")     ConflictResolution conflictResolution
) {

    public EffectBundle {
        competitionBonuses = copyDisciplines(competitionBonuses);
        competitionPenalties = copyDisciplines(competitionPenalties);
        traitProbabilityDeltas = traitProbabilityDeltas == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(traitProbabilityDeltas));
        activeFlags = activeFlags == null ? List.of() : List.copyOf(activeFlags);
        unknownFlags = unknownFlags == null ? List.of() : List.copyOf(unknownFlags);
        conflictResolution = conflictResolution == null ? ConflictResolution.NONE : conflictResolution;
    }

    public static EffectBundle empty() {
        return new EffectBundle(Map.of(), Map.of(), StressModifiers.NONE, BondingModifiers.NONE,
            TrainingModifiers.NONE, Map.of(), List.of(), 0, List.of(), ConflictResolution.NONE);
    }

    public double bonusFor(Discipline discipline) {
        return competitionBonuses.getOrDefault(discipline, 0.0);
    }

    public double penaltyFor(Discipline discipline) {
        return competitionPenalties.getOrDefault(discipline, 0.0);
    }

    private static Map<Discipline, Double> copyDisciplines(Map<Discipline, Double> source) {
        if (source == null || source.isEmpty()) return Map.of();
        return Collections.unmodifiableMap(new EnumMap<>(source));
    }
}
