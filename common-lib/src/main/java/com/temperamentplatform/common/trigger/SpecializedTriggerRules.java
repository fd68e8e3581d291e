package com.temperamentplatform.common.trigger;

import com.temperamentplatform.common.model.TrendDirection;
import com.temperamentplatform.common.pattern.CriticalPeriodType;
import com.temperamentplatform.common.pattern.NeglectSeverity;
import com.temperamentplatform.common.pattern.PatternMetrics;

/**
 * Hand-tuned trigger rules for the standard flag set.
 *
 * <p>Each method is a {@link TriggerPredicate}; {@link TriggerRuleRegistry#standard()}
 * wires them by flag name.
 */
public final class SpecializedTriggerRules {

    private SpecializedTriggerRules() { /* utility class */ }

    public static RuleOutcome brave(TriggerContext ctx) {
        PatternMetrics m = ctx.metrics();
        return RuleOutcome.checks()
            .check("highConsistency", m.consistency().consistencyScore() > 0.7)
            .check("stressReduction", m.stress().averageReduction() < -1)
            .check("taskDiversity", m.taskDiversity().diversityScore() > 0.5)
            .check("fewSpikes", m.stress().spikeCount() <= 2)
            .allOf("Consistent, varied care that reliably lowers stress");
    }

    public static RuleOutcome affectionate(TriggerContext ctx) {
        PatternMetrics m = ctx.metrics();
        return RuleOutcome.checks()
            .check("frequentCare", m.consistency().interactionsPerDay() > 0.8)
            .check("bondGrowth", m.bond().trend().is(TrendDirection.IMPROVING) || m.bond().averageChange() > 0)
            .check("stableCaregiver", m.caregiverStability().stabilityScore() > 0.8)
            .check("positiveBonding", m.bond().positiveRatio() > 0.7)
            .allOf("Frequent, positive bonding with a stable caregiver");
    }

    public static RuleOutcome confident(TriggerContext ctx) {
        PatternMetrics m = ctx.metrics();
        return RuleOutcome.checks()
            .check("strongBondGrowth", m.bond().averageChange() > 1.5)
            .check("lowStress", ctx.subject().stressLevel() < 50)
            .check("taskDiversity", m.taskDiversity().diversityScore() > 0.6)
            .check("excellentCare", m.taskDiversity().excellentRatio() > 0.5)
            .allOf("Strong bonding through varied, excellent care");
    }

    public static RuleOutcome calm(TriggerContext ctx) {
        PatternMetrics m = ctx.metrics();
        return RuleOutcome.checks()
            .check("consistency", m.consistency().consistencyScore() > 0.6)
            .check("stressNotRising", !m.stress().trend().is(TrendDirection.INCREASING))
            .check("noSpikes", m.stress().spikeCount() == 0)
            .check("lowStress", ctx.subject().stressLevel() < 30)
            .allOf("Steady care in a low-stress environment");
    }

    public static RuleOutcome resilient(TriggerContext ctx) {
        PatternMetrics m = ctx.metrics();
        return RuleOutcome.checks()
            .check("experiencedStress", m.stress().spikeCount() >= 1)
            .check("recovered", m.stress().averageReduction() < -1)
            .check("stressNotRising", !m.stress().trend().is(TrendDirection.INCREASING))
            .check("noStressCrisis", !m.hasCriticalPeriod(CriticalPeriodType.STRESS_SPIKE))
            .allOf("Recovered well from stressful episodes");
    }

    public static RuleOutcome social(TriggerContext ctx) {
        PatternMetrics m = ctx.metrics();
        return RuleOutcome.checks()
            .check("taskDiversity", m.taskDiversity().diversityScore() > 0.5)
            .check("multipleCaregivers", m.caregiverStability().distinctCaregivers() >= 2)
            .check("positiveBonding", m.bond().positiveRatio() > 0.6)
            .allOf("Positive experiences with several caregivers");
    }

    public static RuleOutcome fearful(TriggerContext ctx) {
        PatternMetrics m = ctx.metrics();
        boolean unresolvedSpikes = m.stress().spikeCount() > 3 && m.stress().averageReduction() > -0.5;
        boolean erraticCare = m.consistency().consistencyScore() < 0.4 && m.consistency().gapCount() > 2;
        return RuleOutcome.checks()
            .check("unresolvedSpikes", unresolvedSpikes)
            .check("erraticCare", erraticCare)
            .anyOf("Repeated fright without recovery or erratic care");
    }

    public static RuleOutcome insecure(TriggerContext ctx) {
        PatternMetrics m = ctx.metrics();
        boolean caregiverChurn = m.caregiverStability().reassignments() > 2
            && m.bond().trend().is(TrendDirection.DECLINING);
        boolean weakBonding = m.bond().positiveRatio() < 0.3 && m.neglect().neglectRatio() > 0.3;
        return RuleOutcome.checks()
            .check("caregiverChurn", caregiverChurn)
            .check("weakBonding", weakBonding)
            .anyOf("Unstable caregiving relationships");
    }

    public static RuleOutcome antisocial(TriggerContext ctx) {
        PatternMetrics m = ctx.metrics();
        boolean isolated = m.consistency().interactionsPerDay() < 0.2
            && m.bond().trend().is(TrendDirection.DECLINING);
        return RuleOutcome.checks()
            .check("severeNeglect", m.neglect().severity() == NeglectSeverity.SEVERE)
            .check("isolation", isolated)
            .anyOf("Severe neglect or isolation");
    }

    public static RuleOutcome fragile(TriggerContext ctx) {
        PatternMetrics m = ctx.metrics();
        boolean mountingStress = m.stress().spikeCount() > 2
            && m.stress().trend().is(TrendDirection.INCREASING);
        return RuleOutcome.checks()
            .check("stressCrisis", m.hasCriticalPeriod(CriticalPeriodType.STRESS_SPIKE))
            .check("mountingStress", mountingStress)
            .anyOf("Acute or mounting stress");
    }
}
