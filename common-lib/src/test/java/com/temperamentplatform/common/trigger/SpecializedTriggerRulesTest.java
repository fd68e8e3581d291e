package com.temperamentplatform.common.trigger;

import com.temperamentplatform.common.model.InteractionEvent;
import com.temperamentplatform.common.model.QualityGrade;
import com.temperamentplatform.common.pattern.AnalysisSettings;
import com.temperamentplatform.common.pattern.AnalysisWindow;
import com.temperamentplatform.common.pattern.PatternAnalyzer;
import com.temperamentplatform.common.pattern.PatternMetrics;
import com.temperamentplatform.common.registry.DefaultFlagDefinitions;
import com.temperamentplatform.common.registry.FlagDefinitionRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.temperamentplatform.common.Interactions.*;
import static org.junit.jupiter.api.Assertions.*;

class SpecializedTriggerRulesTest {

    private static final FlagDefinitionRegistry REGISTRY = DefaultFlagDefinitions.standard();
    private static final AnalysisWindow TEN_DAYS = AnalysisWindow.forSubject(BIRTH, day(10), AnalysisSettings.DEFAULTS);

    private static TriggerContext context(String flag, int stress, List<InteractionEvent> events) {
        PatternMetrics metrics = PatternAnalyzer.analyze(events, TEN_DAYS);
        return new TriggerContext(REGISTRY.find(flag).orElseThrow(), subject(stress, 50), metrics);
    }

    @Nested
    @DisplayName("positive rules")
    class PositiveTests {

        @Test
        @DisplayName("brave: consistent varied care that lowers stress")
        void brave() {
            assertTrue(SpecializedTriggerRules.brave(context("brave", 10, excellentDailyCare(10))).satisfied());
        }

        @Test
        @DisplayName("calm: fails when current stress is high")
        void calmNeedsLowStress() {
            assertTrue(SpecializedTriggerRules.calm(context("calm", 10, excellentDailyCare(10))).satisfied());
            RuleOutcome stressed = SpecializedTriggerRules.calm(context("calm", 40, excellentDailyCare(10)));
            assertFalse(stressed.satisfied());
            assertFalse(stressed.conditions().get("lowStress"));
        }

        @Test
        @DisplayName("social: needs at least two caregivers")
        void socialNeedsCaregivers() {
            assertFalse(SpecializedTriggerRules.social(context("social", 10, excellentDailyCare(10))).satisfied());

            List<InteractionEvent> shared = new ArrayList<>();
            String[] tasks = {"grooming", "feeding", "handling"};
            for (int d = 0; d < 10; d++) {
                shared.add(event(dayAndHour(d, 9), d % 2 == 0 ? 1L : 2L, tasks[d % 3], QualityGrade.GOOD, 2, -1));
            }
            assertTrue(SpecializedTriggerRules.social(context("social", 10, shared)).satisfied());
        }

        @Test
        @DisplayName("resilient: recovered spikes without a stress crisis")
        void resilient() {
            List<InteractionEvent> events = new ArrayList<>();
            for (int d = 0; d < 10; d++) {
                events.add(event(dayAndHour(d, 8), 1, d == 2 ? 3 : -2));
            }
            assertTrue(SpecializedTriggerRules.resilient(context("resilient", 10, events)).satisfied());
        }
    }

    @Nested
    @DisplayName("negative rules")
    class NegativeTests {

        @Test
        @DisplayName("fragile: a stress-spike critical period is enough")
        void fragile() {
            List<InteractionEvent> events = List.of(
                event(dayAndHour(1, 8), 0, 4),
                event(dayAndHour(1, 9), 0, 2));
            assertTrue(SpecializedTriggerRules.fragile(context("fragile", 10, events)).satisfied());
        }

        @Test
        @DisplayName("fearful: two gaps are not enough")
        void fearfulTwoGaps() {
            // care on days 0, 4 and 8 of 10: gaps are days 1-3 and 5-7
            List<InteractionEvent> events = List.of(
                event(dayAndHour(0, 8), 0, 0),
                event(dayAndHour(4, 8), 0, 0),
                event(dayAndHour(8, 8), 0, 0));
            assertFalse(SpecializedTriggerRules.fearful(context("fearful", 10, events)).satisfied());
        }

        @Test
        @DisplayName("fearful: erratic care with three gaps")
        void fearfulErraticCare() {
            // care on days 3 and 7 of 20: gaps are days 0-2, 4-6 and 8-19
            AnalysisWindow twenty = AnalysisWindow.forSubject(BIRTH, day(20), AnalysisSettings.DEFAULTS);
            List<InteractionEvent> sparse = List.of(event(dayAndHour(3, 8), 0, 0), event(dayAndHour(7, 8), 0, 0));
            TriggerContext ctx = new TriggerContext(REGISTRY.find("fearful").orElseThrow(), subject(10, 50),
                PatternAnalyzer.analyze(sparse, twenty));

            RuleOutcome outcome = SpecializedTriggerRules.fearful(ctx);
            assertTrue(outcome.satisfied());
            assertTrue(outcome.conditions().get("erraticCare"));
        }

        @Test
        @DisplayName("antisocial: severe neglect")
        void antisocial() {
            assertTrue(SpecializedTriggerRules.antisocial(context("antisocial", 10, List.of())).satisfied());
        }
    }

    @Nested
    @DisplayName("generic rule")
    class GenericTests {

        @Test
        @DisplayName("positive: consistent care with bond growth")
        void positive() {
            assertTrue(GenericTriggerRule.INSTANCE.evaluate(context("curious", 10, excellentDailyCare(10))).satisfied());
            assertFalse(GenericTriggerRule.INSTANCE.evaluate(context("curious", 10, List.of())).satisfied());
        }

        @Test
        @DisplayName("negative: any sign of poor care")
        void negative() {
            assertTrue(GenericTriggerRule.INSTANCE.evaluate(context("aloof", 10, List.of())).satisfied());
            assertFalse(GenericTriggerRule.INSTANCE.evaluate(context("aloof", 10, excellentDailyCare(10))).satisfied());
        }

        @Test
        @DisplayName("registry falls back to the generic rule")
        void fallback() {
            assertSame(GenericTriggerRule.INSTANCE, TriggerRuleRegistry.standard().ruleFor("aloof"));
            assertFalse(TriggerRuleRegistry.standard().hasSpecializedRule("curious"));
            assertTrue(TriggerRuleRegistry.standard().hasSpecializedRule("brave"));
        }
    }
}
