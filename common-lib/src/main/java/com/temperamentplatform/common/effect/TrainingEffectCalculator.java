package com.temperamentplatform.common.effect;

import java.util.Collection;
import java.util.Locale;

/**
 * Applies an {@link EffectBundle} and the assigned caregiver's personality to training
 * effectiveness.
 *
 * <pre>
 * value = base + effectiveness + 0.05 * positiveFlags + 0.1 * adaptability (when &gt; 0)
 * value = value * (compatibility &ge; 1 ? compatibility : max(0.9, compatibility))
 * result = max(0.1, value)
 * </pre>
 */
public final class TrainingEffectCalculator {

    private static final double PER_POSITIVE_FLAG = 0.05;
    private static final double ADAPTABILITY_WEIGHT = 0.1;
    private static final double MIN_PENALTY_MULTIPLIER = 0.9;
    private static final double MIN_EFFECTIVENESS = 0.1;

    private TrainingEffectCalculator() { /* utility class */ }

    public static TrainingAdjustment apply(EffectBundle bundle, double baseEffectiveness,
                                           String caregiverPersonality) {
        double modifier = bundle.training().effectiveness()
            + bundle.positiveFlagCount() * PER_POSITIVE_FLAG;
        if (bundle.training().adaptability() > 0) {
            modifier += bundle.training().adaptability() * ADAPTABILITY_WEIGHT;
        }

        double compatibility = personalityCompatibility(bundle.activeFlags(), caregiverPersonality);
        double multiplier = compatibility >= 1.0 ? compatibility : Math.max(MIN_PENALTY_MULTIPLIER, compatibility);
        double modified = Math.max(MIN_EFFECTIVENESS, (baseEffectiveness + modifier) * multiplier);

        double stressImpact = bundle.stress().stressIncrease() - bundle.stress().stressReduction();
        double bondingImpact = bundle.bonding().bondingBonus() - bundle.bonding().bondingDifficulty();
        return new TrainingAdjustment(baseEffectiveness, modifier, compatibility, modified,
            stressImpact, bondingImpact);
    }

    /**
     * Multiplier in [0.5, 1.5] describing how well a caregiver personality suits the flags.
     * Unknown personalities and empty flag sets are neutral (1.0).
     */
    public static double personalityCompatibility(Collection<String> flags, String personality) {
        if (flags == null || flags.isEmpty() || personality == null) return 1.0;

        double score = 1.0;
        switch (personality.toLowerCase(Locale.ROOT)) {
            case "calm" -> {
                if (flags.contains("fearful")) score += 0.2;
                if (flags.contains("reactive")) score += 0.15;
                if (flags.contains("insecure")) score += 0.1;
            }
            case "energetic" -> {
                if (flags.contains("brave")) score += 0.15;
                if (flags.contains("confident")) score += 0.1;
                if (flags.contains("curious")) score += 0.2;
                if (flags.contains("fearful")) score -= 0.1;
                if (flags.contains("fragile")) score -= 0.15;
            }
            case "methodical" -> {
                score += 0.05;
                if (flags.contains("insecure")) score += 0.1;
            }
            default -> { }
        }
        return Math.max(0.5, Math.min(1.5, score));
    }
}
