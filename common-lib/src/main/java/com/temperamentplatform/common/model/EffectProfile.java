package com.temperamentplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Named numeric modifiers a single flag contributes to the aggregated effect bundle.
 *
 * <p>{@code generalCompetitionBonus} is a fraction applied to every discipline and scaled
 * to score points by the aggregator; the per-discipline maps are already in score points.
 * Maps are copied and wrapped read-only on construction.
 */
public record EffectProfile(
    @JsonProperty("generalCompetitionBonus") double generalCompetitionBonus,
    @JsonProperty("competitionBonus")        Map<Discipline, Double> competitionBonus,
    @JsonProperty("competitionPenalty")      Map<Discipline, Double> competitionPenalty,
    @JsonProperty("stressReduction")         double stressReduction,
    @JsonProperty("stressIncrease")          double stressIncrease,
    @JsonProperty("stressResistance")        double stressResistance,
    @JsonProperty("bondingBonus")            double bondingBonus,
    @JsonProperty("bondingDifficulty")       double bondingDifficulty,
    @JsonProperty("bondingSpeed")            double bondingSpeed,
    @JsonProperty("trainingEffectiveness")   double trainingEffectiveness,
    @JsonProperty("adaptability")            double adaptability,
    @JsonProperty("traitWeights")            Map<String, Double> traitWeights
) {

    public static final EffectProfile NONE = builder().build();

    public EffectProfile {
        competitionBonus   = copyDisciplines(competitionBonus);
        competitionPenalty = copyDisciplines(competitionPenalty);
        traitWeights       = traitWeights == null ? Map.of() : Map.copyOf(traitWeights);
    }

    private static Map<Discipline, Double> copyDisciplines(Map<Discipline, Double> source) {
        if (source == null || source.isEmpty()) return Map.of();
        return java.util.Collections.unmodifiableMap(new EnumMap<>(source));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private double generalCompetitionBonus;
        private final Map<Discipline, Double> competitionBonus = new EnumMap<>(Discipline.class);
        private final Map<Discipline, Double> competitionPenalty = new EnumMap<>(Discipline.class);
        private double stressReduction;
        private double stressIncrease;
        private double stressResistance;
        private double bondingBonus;
        private double bondingDifficulty;
        private double bondingSpeed;
        private double trainingEffectiveness;
        private double adaptability;
        private final Map<String, Double> traitWeights = new LinkedHashMap<>();

        private Builder() {}

        public Builder generalCompetitionBonus(double value) { this.generalCompetitionBonus = value; return this; }
        public Builder competitionBonus(Discipline discipline, double points) { competitionBonus.put(discipline, points); return this; }
        public Builder competitionPenalty(Discipline discipline, double points) { competitionPenalty.put(discipline, points); return this; }
        public Builder stressReduction(double value) { this.stressReduction = value; return this; }
        public Builder stressIncrease(double value) { this.stressIncrease = value; return this; }
        public Builder stressResistance(double value) { this.stressResistance = value; return this; }
        public Builder bondingBonus(double value) { this.bondingBonus = value; return this; }
        public Builder bondingDifficulty(double value) { this.bondingDifficulty = value; return this; }
        public Builder bondingSpeed(double value) { this.bondingSpeed = value; return this; }
        public Builder trainingEffectiveness(double value) { this.trainingEffectiveness = value; return this; }
        public Builder adaptability(double value) { this.adaptability = value; return this; }
        public Builder traitWeight(String trait, double delta) { traitWeights.put(trait, delta); return this; }

        public EffectProfile build() {
            return new EffectProfile(generalCompetitionBonus, competitionBonus, competitionPenalty,
                stressReduction, stressIncrease, stressResistance,
                bondingBonus, bondingDifficulty, bondingSpeed,
                trainingEffectiveness, adaptability, traitWeights);
        }
    }
}
