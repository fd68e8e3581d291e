package com.temperamentplatform.flags.service;

import com.temperamentplatform.common.model.EvaluationError;
import com.temperamentplatform.common.model.InteractionEvent;
import com.temperamentplatform.common.model.PopulationEvaluationSummary;
import com.temperamentplatform.common.model.SubjectState;
import com.temperamentplatform.common.pattern.AnalysisWindow;
import com.temperamentplatform.common.pattern.PatternMetrics;
import com.temperamentplatform.common.pipeline.EvaluationOutcome;
import com.temperamentplatform.common.pipeline.EvaluationStatus;
import com.temperamentplatform.common.pipeline.FlagEvaluationPipeline;
import com.temperamentplatform.common.trace.TraceContextUtil;
import com.temperamentplatform.flags.dto.SubjectEvaluationResult;
import com.temperamentplatform.flags.exception.FlagUpdateConflictException;
import com.temperamentplatform.flags.exception.SubjectNotFoundException;
import com.temperamentplatform.flags.store.InteractionStore;
import com.temperamentplatform.flags.store.SubjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Loads subjects and their interactions, runs the flag pipeline and persists new flags.
 *
 * <p>Single-subject evaluations are serialized per id by {@link SubjectEvaluationGuard}.
 * A compare-and-append conflict re-reads the subject and evaluates again, up to
 * {@code flags.evaluation.conflict-retries} times. Population runs evaluate distinct
 * subjects in parallel and record per-subject failures without aborting.
 */
@Service
public class FlagEvaluationService {

    private static final Logger log = LoggerFactory.getLogger(FlagEvaluationService.class);

    private final SubjectStore subjectStore;
    private final InteractionStore interactionStore;
    private final FlagEvaluationPipeline pipeline;
    private final SubjectEvaluationGuard guard;
    private final Clock clock;
    private final int concurrency;
    private final int conflictRetries;

    public FlagEvaluationService(SubjectStore subjectStore,
                                 InteractionStore interactionStore,
                                 FlagEvaluationPipeline pipeline,
                                 SubjectEvaluationGuard guard,
                                 Clock clock,
                                 @Value("${flags.evaluation.concurrency:8}") int concurrency,
                                 @Value("${flags.evaluation.conflict-retries:2}") int conflictRetries) {
        this.subjectStore     = subjectStore;
        this.interactionStore = interactionStore;
        this.pipeline         = pipeline;
        this.guard            = guard;
        this.clock            = clock;
        this.concurrency      = Math.max(1, concurrency);
        this.conflictRetries  = Math.max(0, conflictRetries);
    }

    // ── Single subject ──────────────────────────────────────────────────────

    public Mono<SubjectEvaluationResult> evaluateSubject(long subjectId) {
        return guard.serialize(subjectId, () -> Mono.defer(() -> attempt(subjectId))
            .retryWhen(Retry.max(conflictRetries)
                .filter(FlagUpdateConflictException.class::isInstance)
                .doBeforeRetry(signal -> log.warn(
                    "Flag update conflict, re-evaluating. subjectId={} attempt={}",
                    subjectId, signal.totalRetries() + 1))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure())));
    }

    public Mono<PatternMetrics> analyzePatterns(long subjectId) {
        Instant asOf = clock.instant();
        return loadSubject(subjectId)
            .flatMap(subject -> loadEvents(subject, asOf)
                .map(events -> pipeline.analyze(subject, events, asOf)));
    }

    private Mono<SubjectEvaluationResult> attempt(long subjectId) {
        Instant asOf = clock.instant();
        return loadSubject(subjectId)
            .flatMap(subject -> loadEvents(subject, asOf)
                .flatMap(events -> persist(subject, pipeline.evaluate(subject, events, asOf), asOf)));
    }

    private Mono<SubjectEvaluationResult> persist(SubjectState subject, EvaluationOutcome outcome, Instant asOf) {
        if (!outcome.unknownFlags().isEmpty()) {
            log.warn("Subject holds undefined flags, ignoring them. subjectId={} flags={}",
                     subject.id(), outcome.unknownFlags());
        }
        if (outcome.skipped()) {
            log.debug("Subject skipped. subjectId={} status={}", subject.id(), outcome.status());
            return Mono.just(SubjectEvaluationResult.of(outcome, subject.flags(), asOf));
        }
        if (!outcome.decision().hasChanges()) {
            log.debug("No flags triggered. subjectId={} skipped={}", subject.id(), outcome.decision().skipped());
            return Mono.just(SubjectEvaluationResult.of(outcome, subject.flags(), asOf));
        }

        return subjectStore.appendFlags(subject.id(), subject.flags(), outcome.newFlags())
            .map(saved -> SubjectEvaluationResult.of(outcome, saved.flags(), asOf))
            .doOnNext(r -> log.info("Flags assigned. subjectId={} newFlags={} flags={} dampening={}",
                                       r.subjectId(), r.newFlags(), r.flags(),
                                       r.conflicts().dampeningFactor()));
    }

    private Mono<SubjectState> loadSubject(long subjectId) {
        return subjectStore.getSubject(subjectId)
            .switchIfEmpty(Mono.error(new SubjectNotFoundException(subjectId)));
    }

    private Mono<List<InteractionEvent>> loadEvents(SubjectState subject, Instant asOf) {
        AnalysisWindow window = pipeline.windowFor(subject, asOf);
        if (window.isEmpty()) {
            return Mono.just(List.of());
        }
        return interactionStore.listInteractions(subject.id(), window.start(), window.end())
            .collectList();
    }

    // ── Population ──────────────────────────────────────────────────────────

    public Mono<PopulationEvaluationSummary> evaluatePopulation(Collection<Long> subjectIds) {
        return evaluatePopulation(subjectIds, null);
    }

    /**
     * Evaluates {@code subjectIds} under {@code callerTraceId}, or under a fresh trace id
     * when the caller supplied none.
     */
    public Mono<PopulationEvaluationSummary> evaluatePopulation(Collection<Long> subjectIds, String callerTraceId) {
        String traceId = callerTraceId == null || callerTraceId.isBlank()
            ? TraceContextUtil.newTraceId()
            : callerTraceId.trim();
        List<Long> distinct = new ArrayList<>(new LinkedHashSet<>(subjectIds));

        Mono<PopulationEvaluationSummary> run = TraceContextUtil.logWithTrace(() ->
                log.info("Population evaluation started. subjects={} concurrency={}", distinct.size(), concurrency))
            .thenMany(Flux.fromIterable(distinct)
                .flatMap(this::evaluateForBatch, concurrency))
            .collectList()
            .map(items -> summarize(traceId, distinct.size(), items))
            .flatMap(summary -> TraceContextUtil.logWithTrace(() ->
                    log.info("Population evaluation finished. evaluated={} assigned={} skipped={} errors={}",
                             summary.evaluated(), summary.assigned(), summary.skipped(), summary.errors().size()))
                .thenReturn(summary));

        return TraceContextUtil.withTraceId(run, traceId);
    }

    /** Every subject born within the maturity cutoff that still has room for flags. */
    public Mono<PopulationEvaluationSummary> evaluateEligiblePopulation() {
        return evaluateEligiblePopulation(null);
    }

    public Mono<PopulationEvaluationSummary> evaluateEligiblePopulation(String callerTraceId) {
        Instant bornAfter = clock.instant().minus(Duration.ofDays(pipeline.settings().maturityCutoffDays()));
        return subjectStore.findEvaluationCandidates(bornAfter, SubjectState.MAX_FLAGS)
            .collectList()
            .flatMap(ids -> evaluatePopulation(ids, callerTraceId));
    }

    private Mono<BatchItem> evaluateForBatch(long subjectId) {
        return evaluateSubject(subjectId)
            .map(result -> new BatchItem(subjectId, result, null))
            .onErrorResume(e -> TraceContextUtil.logWithTrace(() ->
                    log.warn("Subject evaluation failed, continuing batch. subjectId={} error={}",
                             subjectId, e.getMessage()))
                .thenReturn(new BatchItem(subjectId, null, e.getMessage())));
    }

    private static PopulationEvaluationSummary summarize(String traceId, int requested, List<BatchItem> items) {
        int evaluated = 0;
        int assigned = 0;
        int skipped = 0;
        List<EvaluationError> errors = new ArrayList<>();
        for (BatchItem item : items) {
            if (item.result() == null) {
                errors.add(new EvaluationError(item.subjectId(), item.error()));
            } else if (item.result().status() == EvaluationStatus.EVALUATED) {
                evaluated++;
                assigned += item.result().newFlags().size();
            } else {
                skipped++;
            }
        }
        errors.sort((a, b) -> Long.compare(a.subjectId(), b.subjectId()));
        return new PopulationEvaluationSummary(traceId, requested, evaluated, assigned, skipped, errors);
    }

    private record BatchItem(long subjectId, SubjectEvaluationResult result, String error) {}
}
