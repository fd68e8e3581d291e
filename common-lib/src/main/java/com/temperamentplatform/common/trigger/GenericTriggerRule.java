package com.temperamentplatform.common.trigger;

import com.temperamentplatform.common.pattern.PatternMetrics;

/**
 * Valence-driven fallback for flags without a specialized rule.
 *
 * <p>Positive flags need consistent care with bond growth; negative flags trigger on
 * any one sign of poor care.
 */
public final class GenericTriggerRule implements TriggerPredicate {

    public static final GenericTriggerRule INSTANCE = new GenericTriggerRule();

    private GenericTriggerRule() {}

    @Override
    public RuleOutcome evaluate(TriggerContext context) {
        PatternMetrics m = context.metrics();
        if (context.definition().isPositive()) {
            return RuleOutcome.checks()
                .check("consistency", m.consistency().consistencyScore() > 0.6)
                .check("bondGrowth", m.bond().averageChange() > 0)
                .allOf("Consistent care with positive bonding");
        }
        return RuleOutcome.checks()
            .check("inconsistency", m.consistency().consistencyScore() < 0.4)
            .check("bondLoss", m.bond().averageChange() < 0)
            .check("neglect", m.neglect().neglected())
            .anyOf("Inconsistent or neglectful care");
    }
}
