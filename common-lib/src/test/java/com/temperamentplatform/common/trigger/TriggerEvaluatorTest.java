package com.temperamentplatform.common.trigger;

import com.temperamentplatform.common.model.FlagDefinition;
import com.temperamentplatform.common.model.FlagValence;
import com.temperamentplatform.common.model.SubjectState;
import com.temperamentplatform.common.model.TrendDirection;
import com.temperamentplatform.common.pattern.AnalysisSettings;
import com.temperamentplatform.common.pattern.AnalysisWindow;
import com.temperamentplatform.common.pattern.PatternAnalyzer;
import com.temperamentplatform.common.pattern.PatternMetrics;
import com.temperamentplatform.common.registry.DefaultFlagDefinitions;
import com.temperamentplatform.common.registry.FlagDefinitionRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.temperamentplatform.common.Interactions.*;
import static org.junit.jupiter.api.Assertions.*;

class TriggerEvaluatorTest {

    private static final AnalysisWindow FIVE_DAYS = AnalysisWindow.forSubject(BIRTH, day(5), AnalysisSettings.DEFAULTS);

    private static final PatternMetrics EXCELLENT = PatternAnalyzer.analyze(excellentDailyCare(5), FIVE_DAYS);
    private static final PatternMetrics EMPTY = PatternAnalyzer.analyze(List.of(), FIVE_DAYS);

    private final TriggerEvaluator standard = new TriggerEvaluator(
        DefaultFlagDefinitions.standard(), TriggerRuleRegistry.standard());

    // ── Single-flag evaluation ──────────────────────────────────────────

    @Nested
    @DisplayName("evaluate()")
    class EvaluateTests {

        private final FlagDefinition steady = new FlagDefinition(
            "steady", "Steady", FlagValence.POSITIVE, 0.5, Set.of(), null);

        private final TriggerPredicate steadyRule = ctx -> RuleOutcome.checks()
            .check("fullConsistency", ctx.metrics().consistency().consistencyScore() >= 0.99)
            .check("bondImproving", ctx.metrics().bond().trend().is(TrendDirection.IMPROVING))
            .check("stressNotRising", ctx.metrics().stress().trend().is(TrendDirection.DECREASING)
                || ctx.metrics().stress().trend().is(TrendDirection.STABLE))
            .check("singleCaregiver", ctx.metrics().caregiverStability().distinctCaregivers() == 1)
            .allOf("Ideal early care");

        private TriggerEvaluator evaluatorWith(TriggerPredicate rule) {
            return new TriggerEvaluator(FlagDefinitionRegistry.of(steady),
                TriggerRuleRegistry.empty().with("steady", rule));
        }

        @Test
        @DisplayName("young subject with ideal care triggers a flag requiring exactly that")
        void idealCareTriggers() {
            TriggerVerdict verdict = evaluatorWith(steadyRule).evaluate(steady, subject(10, 50), EXCELLENT, day(5));

            assertTrue(verdict.triggered(), verdict.reason());
            assertEquals("Ideal early care", verdict.reason());
            assertEquals(0.5 * 0.6 * 0.95 * 1.1, verdict.threshold(), 1e-9);
            assertTrue(verdict.strength() >= verdict.threshold());
        }

        @Test
        @DisplayName("conditions keep evaluation order and end with patternStrength")
        void conditionOrder() {
            TriggerVerdict verdict = evaluatorWith(steadyRule).evaluate(steady, subject(10, 50), EXCELLENT, day(5));
            assertEquals(List.of("fullConsistency", "bondImproving", "stressNotRising", "singleCaregiver",
                TriggerEvaluator.PATTERN_STRENGTH), List.copyOf(verdict.conditions().keySet()));
        }

        @Test
        @DisplayName("rule met but strength below threshold → not triggered")
        void strengthGate() {
            TriggerVerdict verdict = evaluatorWith(ctx -> RuleOutcome.checks().check("always", true).allOf("ok"))
                .evaluate(steady, subject(10, 50), EMPTY, day(5));

            assertFalse(verdict.triggered());
            assertFalse(verdict.conditions().get(TriggerEvaluator.PATTERN_STRENGTH));
            assertTrue(verdict.reason().startsWith("Pattern strength"));
        }

        @Test
        @DisplayName("failing rule lists the failed conditions")
        void failingRuleReason() {
            TriggerVerdict verdict = evaluatorWith(steadyRule).evaluate(steady, subject(10, 50), EMPTY, day(5));
            assertFalse(verdict.triggered());
            assertTrue(verdict.reason().contains("fullConsistency"));
        }

        @Test
        @DisplayName("a throwing rule yields an evaluation-error verdict")
        void throwingRule() {
            TriggerVerdict verdict = evaluatorWith(ctx -> { throw new IllegalStateException("boom"); })
                .evaluate(steady, subject(10, 50), EXCELLENT, day(5));

            assertFalse(verdict.triggered());
            assertEquals(TriggerVerdict.EVALUATION_ERROR, verdict.reason());
        }
    }

    // ── Candidate selection ─────────────────────────────────────────────

    @Nested
    @DisplayName("evaluateAll()")
    class EvaluateAllTests {

        @Test
        @DisplayName("held flags and flags conflicting with them are not evaluated")
        void skipsHeldAndConflicting() {
            Map<String, TriggerVerdict> verdicts = standard.evaluateAll(subject(10, 50, "brave"), EXCELLENT, day(5));

            assertFalse(verdicts.containsKey("brave"));
            assertFalse(verdicts.containsKey("fearful"));
            assertFalse(verdicts.containsKey("insecure"));
            assertTrue(verdicts.containsKey("calm"));
        }

        @Test
        @DisplayName("subject at capacity → nothing evaluated")
        void atCapacity() {
            SubjectState full = subject(10, 50, "brave", "calm", "curious", "resilient", "social");
            assertTrue(standard.evaluateAll(full, EXCELLENT, day(5)).isEmpty());
        }

        @Test
        @DisplayName("verdicts follow definition order")
        void definitionOrder() {
            Map<String, TriggerVerdict> verdicts = standard.evaluateAll(subject(10, 50), EXCELLENT, day(5));
            assertEquals(DefaultFlagDefinitions.standard().all().stream().map(FlagDefinition::name).toList(),
                List.copyOf(verdicts.keySet()));
        }

        @Test
        @DisplayName("no interactions → no positive flag triggers")
        void noInteractionsNoPositive() {
            FlagDefinitionRegistry registry = DefaultFlagDefinitions.standard();
            Map<String, TriggerVerdict> verdicts = standard.evaluateAll(subject(10, 50), EMPTY, day(5));

            verdicts.forEach((name, verdict) -> {
                if (registry.find(name).orElseThrow().isPositive()) {
                    assertFalse(verdict.triggered(), name + " should not trigger");
                }
            });
            assertTrue(verdicts.get("antisocial").triggered());
        }
    }
}
