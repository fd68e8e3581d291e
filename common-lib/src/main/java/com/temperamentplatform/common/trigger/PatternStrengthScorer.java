package com.temperamentplatform.common.trigger;

import com.temperamentplatform.common.model.FlagValence;
import com.temperamentplatform.common.pattern.PatternMetrics;

/**
 * Collapses pattern metrics into a single strength score per valence, in [0,1].
 *
 * <pre>
 * positive = 0.3*consistency + 0.1*max(0, avgBond) + 0.1*max(0, -avgReduction)
 *          + 0.2*diversity + 0.2*excellentRatio
 * negative = 0.3*(1 - consistency) + 0.1*max(0, -avgBond) + 0.1*max(0, avgStressChange)
 *          + 0.1*spikes + 0.2*neglectRatio
 * </pre>
 */
public final class PatternStrengthScorer {

    private PatternStrengthScorer() { /* utility class */ }

    public static double strength(FlagValence valence, PatternMetrics metrics) {
        return valence == FlagValence.POSITIVE ? positive(metrics) : negative(metrics);
    }

    public static double positive(PatternMetrics m) {
        double score = m.consistency().consistencyScore() * 0.3
            + Math.max(0, m.bond().averageChange() * 0.1)
            + Math.max(0, -m.stress().averageReduction() * 0.1)
            + m.taskDiversity().diversityScore() * 0.2
            + m.taskDiversity().excellentRatio() * 0.2;
        return clamp01(score);
    }

    public static double negative(PatternMetrics m) {
        double score = (1.0 - m.consistency().consistencyScore()) * 0.3
            + Math.max(0, -m.bond().averageChange() * 0.1)
            + Math.max(0, m.stress().averageChange() * 0.1)
            + m.stress().spikeCount() * 0.1
            + m.neglect().neglectRatio() * 0.2;
        return clamp01(score);
    }

    private static double clamp01(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
