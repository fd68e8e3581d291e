package com.temperamentplatform.common.effect;

import com.temperamentplatform.common.conflict.ConflictResolver;
import com.temperamentplatform.common.conflict.ConflictSeverityTable;
import com.temperamentplatform.common.conflict.DampeningPolicy;
import com.temperamentplatform.common.model.Discipline;
import com.temperamentplatform.common.registry.DefaultFlagDefinitions;
import com.temperamentplatform.common.registry.FlagDefinitionRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SplittableRandom;
import java.util.random.RandomGenerator;

import static org.junit.jupiter.api.Assertions.*;

class DownstreamEffectCalculatorsTest {

    private static final FlagDefinitionRegistry REGISTRY = DefaultFlagDefinitions.standard();
    private static final ConflictResolver RESOLVER =
        new ConflictResolver(REGISTRY, ConflictSeverityTable.standard(), DampeningPolicy.DEFAULTS);
    private static final EffectAggregator AGGREGATOR = new EffectAggregator(REGISTRY, RESOLVER);

    // ── Competition ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("competition")
    class CompetitionTests {

        @Test
        @DisplayName("bonus, penalty and stress resistance are applied")
        void applied() {
            CompetitionAdjustment adj = CompetitionEffectCalculator.apply(
                AGGREGATOR.aggregate(List.of("brave")), Discipline.SHOW_JUMPING, 50);

            assertEquals(2.0, adj.bonus(), 1e-9);
            assertEquals(0.6, adj.stressResistanceBonus(), 1e-9);
            assertEquals(52.6, adj.modifiedScore(), 1e-9);
        }

        @Test
        @DisplayName("score never drops below zero")
        void floorAtZero() {
            CompetitionAdjustment adj = CompetitionEffectCalculator.apply(
                AGGREGATOR.aggregate(List.of("fearful")), Discipline.SHOW_JUMPING, 1);
            assertEquals(0.0, adj.modifiedScore());
        }
    }

    // ── Training ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("training")
    class TrainingTests {

        @Test
        @DisplayName("positive flags and a compatible caregiver boost effectiveness")
        void compatibleCaregiver() {
            TrainingAdjustment adj = TrainingEffectCalculator.apply(
                AGGREGATOR.aggregate(List.of("brave")), 0.5, "energetic");

            assertEquals(0.16, adj.flagModifier(), 1e-9);
            assertEquals(1.15, adj.personalityCompatibility(), 1e-9);
            assertEquals(0.66 * 1.15, adj.modifiedEffectiveness(), 1e-9);
        }

        @Test
        @DisplayName("incompatible caregiver penalty is softened to 0.9")
        void softenedPenalty() {
            TrainingAdjustment adj = TrainingEffectCalculator.apply(
                AGGREGATOR.aggregate(List.of("fearful", "fragile")), 0.8, "Energetic");

            assertEquals(0.75, adj.personalityCompatibility(), 1e-9);
            assertEquals((0.8 - 0.2) * 0.9, adj.modifiedEffectiveness(), 1e-9);
        }

        @Test
        @DisplayName("effectiveness never drops below 0.1")
        void floor() {
            TrainingAdjustment adj = TrainingEffectCalculator.apply(
                AGGREGATOR.aggregate(List.of("fearful")), 0.0, "calm");
            assertEquals(0.1, adj.modifiedEffectiveness(), 1e-9);
        }

        @Test
        @DisplayName("compatibility rules by personality")
        void compatibility() {
            assertEquals(1.45, TrainingEffectCalculator.personalityCompatibility(
                List.of("fearful", "reactive", "insecure"), "calm"), 1e-9);
            assertEquals(1.15, TrainingEffectCalculator.personalityCompatibility(
                List.of("insecure"), "methodical"), 1e-9);
            assertEquals(1.0, TrainingEffectCalculator.personalityCompatibility(List.of("brave"), "grumpy"));
            assertEquals(1.0, TrainingEffectCalculator.personalityCompatibility(List.of(), "calm"));
        }
    }

    // ── Breeding ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("breeding")
    class BreedingTests {

        private final Map<String, Double> base = Map.of("fearless", 0.2, "composed", 0.5);

        @Test
        @DisplayName("each parent contributes half of its trait deltas")
        void halfEach() {
            BreedingPrediction prediction = new BreedingEffectCalculator(RESOLVER, new SplittableRandom(1))
                .predict(AGGREGATOR.aggregate(List.of("brave")), AGGREGATOR.aggregate(List.of("calm")), base);

            Map<String, Double> p = prediction.traitProbabilities();
            assertEquals(0.35, p.get("fearless"), 1e-9);
            assertEquals(0.1, p.get("bold"), 1e-9);
            assertEquals(0.575, p.get("composed"), 1e-9);
            assertFalse(prediction.parentConflicts().hasConflicts());
        }

        @Test
        @DisplayName("conflicting parents halve the change from base")
        void conflictingParents() {
            BreedingPrediction prediction = new BreedingEffectCalculator(RESOLVER, new SplittableRandom(1))
                .predict(AGGREGATOR.aggregate(List.of("brave")), AGGREGATOR.aggregate(List.of("fearful")), base);

            assertTrue(prediction.parentConflicts().hasConflicts());
            assertEquals(0.275, prediction.traitProbabilities().get("fearless"), 1e-9);
            assertEquals(0.5, prediction.traitProbabilities().get("composed"), 1e-9);
            assertEquals(0.075, prediction.traitProbabilities().get("nervous"), 1e-9);
        }

        @Test
        @DisplayName("probabilities are clamped to [0,1]")
        void clamped() {
            BreedingPrediction prediction = new BreedingEffectCalculator(RESOLVER, new SplittableRandom(1))
                .predict(AGGREGATOR.aggregate(List.of("brave")), AGGREGATOR.aggregate(List.of("brave")),
                    Map.of("fearless", 0.9));
            assertEquals(1.0, prediction.traitProbabilities().get("fearless"));
        }

        @Test
        @DisplayName("same seed → same inherited traits")
        void seededRolls() {
            EffectBundle dam = AGGREGATOR.aggregate(List.of("brave", "calm"));
            EffectBundle sire = AGGREGATOR.aggregate(List.of("social"));

            List<String> first = new BreedingEffectCalculator(RESOLVER, new SplittableRandom(7))
                .predict(dam, sire, base).inheritedTraits();
            List<String> second = new BreedingEffectCalculator(RESOLVER, new SplittableRandom(7))
                .predict(dam, sire, base).inheritedTraits();
            assertEquals(first, second);
        }

        @Test
        @DisplayName("rolls compare the generator's draw against each probability")
        void rollThreshold() {
            RandomGenerator alwaysMid = () -> Long.MIN_VALUE >>> 1;
            Map<String, Double> probabilities = new LinkedHashMap<>();
            probabilities.put("likely", 0.9);
            probabilities.put("unlikely", 0.1);

            assertEquals(List.of("likely"), new BreedingEffectCalculator(RESOLVER, alwaysMid).roll(probabilities));
        }
    }
}
