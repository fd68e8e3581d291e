package com.temperamentplatform.common.effect;

import com.temperamentplatform.common.conflict.ConflictResolution;
import com.temperamentplatform.common.conflict.ConflictResolver;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.random.RandomGenerator;

/**
 * Adjusts offspring trait probabilities from both parents' effect bundles.
 *
 * <p>Each parent contributes half of its trait deltas. Traits missing from the base map
 * start at 0. When the parents' combined flags conflict, the change from the base
 * probability is halved. Results are clamped to [0,1].
 *
 * <p>Trait rolls draw from the injected {@link RandomGenerator}; pass a seeded generator
 * for reproducible output.
 */
public final class BreedingEffectCalculator {

    private static final double PARENT_SHARE = 0.5;
    private static final double CONFLICT_CHANGE_FACTOR = 0.5;

    private final ConflictResolver conflictResolver;
    private final RandomGenerator random;

    public BreedingEffectCalculator(ConflictResolver conflictResolver, RandomGenerator random) {
        this.conflictResolver = conflictResolver;
        this.random = random;
    }

    public BreedingPrediction predict(EffectBundle dam, EffectBundle sire, Map<String, Double> baseProbabilities) {
        Map<String, Double> combined = new LinkedHashMap<>();
        dam.traitProbabilityDeltas().forEach((t, d) -> combined.merge(t, d * PARENT_SHARE, Double::sum));
        sire.traitProbabilityDeltas().forEach((t, d) -> combined.merge(t, d * PARENT_SHARE, Double::sum));

        Collection<String> parentFlags = new LinkedHashSet<>(dam.activeFlags());
        parentFlags.addAll(sire.activeFlags());
        ConflictResolution conflicts = conflictResolver.resolve(parentFlags);

        Map<String, Double> adjusted = new LinkedHashMap<>(baseProbabilities);
        combined.forEach((trait, delta) -> adjusted.put(trait,
            clamp01(baseProbabilities.getOrDefault(trait, 0.0) + delta)));

        if (conflicts.hasConflicts()) {
            adjusted.replaceAll((trait, p) -> {
                double base = baseProbabilities.getOrDefault(trait, 0.0);
                return clamp01(base + (p - base) * CONFLICT_CHANGE_FACTOR);
            });
        }

        return new BreedingPrediction(baseProbabilities, adjusted, conflicts, roll(adjusted));
    }

    /** Traits whose roll falls under their probability, in map order. */
    public List<String> roll(Map<String, Double> probabilities) {
        List<String> inherited = new ArrayList<>();
        probabilities.forEach((trait, p) -> {
            if (random.nextDouble() < p) inherited.add(trait);
        });
        return inherited;
    }

    private static double clamp01(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
