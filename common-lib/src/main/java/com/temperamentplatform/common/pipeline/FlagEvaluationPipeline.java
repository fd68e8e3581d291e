package com.temperamentplatform.common.pipeline;

import com.temperamentplatform.common.assignment.AssignmentDecision;
import com.temperamentplatform.common.assignment.AssignmentEngine;
import com.temperamentplatform.common.conflict.ConflictResolution;
import com.temperamentplatform.common.conflict.ConflictResolver;
import com.temperamentplatform.common.model.InteractionEvent;
import com.temperamentplatform.common.model.SubjectState;
import com.temperamentplatform.common.pattern.AnalysisSettings;
import com.temperamentplatform.common.pattern.AnalysisWindow;
import com.temperamentplatform.common.pattern.PatternAnalyzer;
import com.temperamentplatform.common.pattern.PatternMetrics;
import com.temperamentplatform.common.registry.FlagDefinitionRegistry;
import com.temperamentplatform.common.trigger.TriggerEvaluator;
import com.temperamentplatform.common.trigger.TriggerVerdict;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Analyze, evaluate triggers, decide assignments: one subject, one evaluation instant.
 *
 * <p>The pipeline reads nothing but its arguments and the injected registries, so two runs
 * with the same inputs produce the same outcome. Persisting the decision is the caller's job.
 */
public final class FlagEvaluationPipeline {

    private final FlagDefinitionRegistry registry;
    private final TriggerEvaluator triggerEvaluator;
    private final ConflictResolver conflictResolver;
    private final AnalysisSettings settings;

    public FlagEvaluationPipeline(FlagDefinitionRegistry registry,
                                  TriggerEvaluator triggerEvaluator,
                                  ConflictResolver conflictResolver,
                                  AnalysisSettings settings) {
        this.registry = registry;
        this.triggerEvaluator = triggerEvaluator;
        this.conflictResolver = conflictResolver;
        this.settings = settings;
    }

    public AnalysisSettings settings() {
        return settings;
    }

    public AnalysisWindow windowFor(SubjectState subject, Instant asOf) {
        Instant birth = subject.birthDate() == null ? asOf : subject.birthDate();
        return AnalysisWindow.forSubject(birth, asOf, settings);
    }

    public PatternMetrics analyze(SubjectState subject, List<InteractionEvent> events, Instant asOf) {
        return PatternAnalyzer.analyze(events, windowFor(subject, asOf));
    }

    public boolean isPastMaturity(SubjectState subject, Instant asOf) {
        return subject.ageInDays(asOf) >= settings.maturityCutoffDays();
    }

    public EvaluationOutcome evaluate(SubjectState subject, List<InteractionEvent> events, Instant asOf) {
        PatternMetrics metrics = analyze(subject, events, asOf);
        List<String> unknown = registry.unknown(subject.flags());

        if (isPastMaturity(subject, asOf)) {
            return unchanged(subject, EvaluationStatus.PAST_MATURITY, metrics, unknown);
        }
        if (subject.atFlagCapacity()) {
            return unchanged(subject, EvaluationStatus.AT_CAPACITY, metrics, unknown);
        }

        Map<String, TriggerVerdict> verdicts = triggerEvaluator.evaluateAll(subject, metrics, asOf);
        AssignmentDecision decision = AssignmentEngine.decide(registry, subject.flags(), verdicts);
        ConflictResolution conflicts = conflictResolver.resolve(subject.flags(), decision.newFlags());

        return new EvaluationOutcome(subject.id(), EvaluationStatus.EVALUATED, metrics, verdicts,
            decision, conflicts, unknown);
    }

    private EvaluationOutcome unchanged(SubjectState subject, EvaluationStatus status,
                                        PatternMetrics metrics, List<String> unknown) {
        AssignmentDecision none = new AssignmentDecision(List.of(), Map.of(), Map.of(), subject.flags());
        return new EvaluationOutcome(subject.id(), status, metrics, Map.of(), none,
            conflictResolver.resolve(subject.flags()), unknown);
    }
}
