package com.temperamentplatform.common.trigger;

import com.temperamentplatform.common.model.FlagDefinition;
import com.temperamentplatform.common.model.SubjectState;
import com.temperamentplatform.common.pattern.PatternMetrics;
import com.temperamentplatform.common.registry.FlagDefinitionRegistry;
import com.temperamentplatform.common.threshold.ThresholdCalculator;
import com.temperamentplatform.common.threshold.ThresholdResult;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Decides, per flag, whether a subject's pattern metrics meet that flag's trigger rule.
 *
 * <p>A flag triggers when its rule is satisfied <em>and</em> the valence pattern strength
 * reaches the subject-specific threshold from {@link ThresholdCalculator}.
 *
 * <p>Stateless apart from the two injected registries; safe to share between threads.
 */
public final class TriggerEvaluator {

    public static final String PATTERN_STRENGTH = "patternStrength";

    private final FlagDefinitionRegistry definitions;
    private final TriggerRuleRegistry rules;

    public TriggerEvaluator(FlagDefinitionRegistry definitions, TriggerRuleRegistry rules) {
        this.definitions = definitions;
        this.rules = rules;
    }

    /**
     * Evaluates every candidate flag in definition order.
     *
     * <p>Flags the subject already holds, flags that conflict with a held flag, and every
     * flag once the subject is at capacity are not evaluated and have no verdict.
     *
     * @return verdicts keyed by flag name, in definition order
     */
    public Map<String, TriggerVerdict> evaluateAll(SubjectState subject, PatternMetrics metrics, Instant asOf) {
        Map<String, TriggerVerdict> verdicts = new LinkedHashMap<>();
        if (subject.atFlagCapacity()) return verdicts;

        for (FlagDefinition def : definitions.all()) {
            if (subject.hasFlag(def.name())) continue;
            if (definitions.conflictsWithAny(def.name(), subject.flags())) continue;
            verdicts.put(def.name(), evaluate(def, subject, metrics, asOf));
        }
        return verdicts;
    }

    /** Evaluates a single flag regardless of the subject's current flags. */
    public TriggerVerdict evaluate(FlagDefinition definition, SubjectState subject,
                                   PatternMetrics metrics, Instant asOf) {
        ThresholdResult threshold = ThresholdCalculator.forFlag(definition, subject, asOf);

        RuleOutcome outcome;
        try {
            outcome = rules.ruleFor(definition.name())
                .evaluate(new TriggerContext(definition, subject, metrics));
        } catch (RuntimeException e) {
            return TriggerVerdict.error(definition.name(), threshold.finalThreshold());
        }

        double strength = PatternStrengthScorer.strength(definition.valence(), metrics);
        boolean strongEnough = strength >= threshold.finalThreshold();

        Map<String, Boolean> conditions = new LinkedHashMap<>(outcome.conditions());
        conditions.put(PATTERN_STRENGTH, strongEnough);

        String reason;
        if (!outcome.satisfied()) {
            reason = outcome.reason();
        } else if (!strongEnough) {
            reason = String.format(Locale.ROOT, "Pattern strength %.2f below threshold %.2f",
                strength, threshold.finalThreshold());
        } else {
            reason = outcome.reason();
        }

        return new TriggerVerdict(definition.name(), outcome.satisfied() && strongEnough,
            reason, conditions, strength, threshold.finalThreshold());
    }
}
