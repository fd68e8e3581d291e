package com.temperamentplatform.common.effect;

import com.temperamentplatform.common.model.Discipline;

/**
 * Applies an {@link EffectBundle} to a competition score:
 * {@code max(0, base + bonus[d] - penalty[d] + 2 * stressResistance)}.
 */
public final class CompetitionEffectCalculator {

    private static final double STRESS_RESISTANCE_POINTS = 2.0;

    private CompetitionEffectCalculator() { /* utility class */ }

    public static CompetitionAdjustment apply(EffectBundle bundle, Discipline discipline, double baseScore) {
        double bonus = bundle.bonusFor(discipline);
        double penalty = bundle.penaltyFor(discipline);
        double resistance = Math.max(0, bundle.stress().stressResistance()) * STRESS_RESISTANCE_POINTS;
        double modified = Math.max(0, baseScore + bonus - penalty + resistance);
        return new CompetitionAdjustment(discipline, baseScore, bonus, penalty, resistance, modified);
    }
}
