package com.temperamentplatform.common.threshold;

import com.temperamentplatform.common.model.FlagDefinition;
import com.temperamentplatform.common.model.SubjectState;

import java.time.Instant;

/**
 * Computes how easily a flag triggers for a given subject.
 *
 * <p>Younger and more stressed subjects get a lower threshold (more impressionable);
 * a strong bond raises it slightly.
 *
 * <pre>
 * final = clamp(base * age * stress * bond, 0.1, 1.0)
 * age    : &le;7d 0.6 | &le;30d 0.7 | &le;90d 0.8 | else 1.0
 * stress : max(0.5, 1 - stress/200)
 * bond   : min(1.2, 1 + bond/500)
 * </pre>
 */
public final class ThresholdCalculator {

    private static final double MIN_THRESHOLD = 0.1;
    private static final double MAX_THRESHOLD = 1.0;

    private static final double MIN_STRESS_MODIFIER = 0.5;
    private static final double STRESS_DIVISOR = 200.0;
    private static final double MAX_BOND_MODIFIER = 1.2;
    private static final double BOND_DIVISOR = 500.0;

    private ThresholdCalculator() { /* utility class */ }

    public static ThresholdResult forFlag(FlagDefinition definition, SubjectState subject, Instant asOf) {
        return calculate(definition.baseThreshold(), subject.ageInDays(asOf),
            subject.stressLevel(), subject.bondScore());
    }

    public static ThresholdResult calculate(double baseThreshold, long ageDays,
                                            double stressLevel, double bondScore) {
        double age = ageModifier(ageDays);
        double stress = stressModifier(stressLevel);
        double bond = bondModifier(bondScore);

        double threshold = Math.max(MIN_THRESHOLD, Math.min(MAX_THRESHOLD, baseThreshold * age * stress * bond));
        return new ThresholdResult(baseThreshold, age, stress, bond, threshold, 1.0 - threshold);
    }

    public static double ageModifier(long ageDays) {
        if (ageDays <= 7) return 0.6;
        if (ageDays <= 30) return 0.7;
        if (ageDays <= 90) return 0.8;
        return 1.0;
    }

    public static double stressModifier(double stressLevel) {
        return Math.max(MIN_STRESS_MODIFIER, 1.0 - stressLevel / STRESS_DIVISOR);
    }

    public static double bondModifier(double bondScore) {
        return Math.min(MAX_BOND_MODIFIER, 1.0 + bondScore / BOND_DIVISOR);
    }
}
