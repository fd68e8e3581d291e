package com.temperamentplatform.flags.controller;

import com.temperamentplatform.common.effect.BreedingPrediction;
import com.temperamentplatform.common.effect.CompetitionAdjustment;
import com.temperamentplatform.common.effect.EffectBundle;
import com.temperamentplatform.common.effect.TrainingAdjustment;
import com.temperamentplatform.common.model.PopulationEvaluationSummary;
import com.temperamentplatform.common.pattern.PatternMetrics;
import com.temperamentplatform.flags.dto.BreedingRequest;
import com.temperamentplatform.flags.dto.CompetitionRequest;
import com.temperamentplatform.flags.dto.FlagDefinitionSummary;
import com.temperamentplatform.flags.dto.SubjectEvaluationResult;
import com.temperamentplatform.flags.dto.TrainingRequest;
import com.temperamentplatform.flags.exception.SubjectNotFoundException;
import com.temperamentplatform.flags.service.EffectBundleService;
import com.temperamentplatform.flags.service.FlagEvaluationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/flags")
public class FlagController {

    private static final Logger log = LoggerFactory.getLogger(FlagController.class);

    private final FlagEvaluationService evaluationService;
    private final EffectBundleService effectService;

    public FlagController(FlagEvaluationService evaluationService, EffectBundleService effectService) {
        this.evaluationService = evaluationService;
        this.effectService     = effectService;
    }

    // ── Evaluation ──────────────────────────────────────────────────────────

    @PostMapping("/subjects/{id}/evaluate")
    public Mono<ResponseEntity<SubjectEvaluationResult>> evaluate(@PathVariable long id) {
        log.info("Evaluation requested. subjectId={}", id);
        return notFoundAware(id, evaluationService.evaluateSubject(id));
    }

    @PostMapping("/evaluate")
    public Mono<ResponseEntity<PopulationEvaluationSummary>> evaluateBatch(
            @RequestBody List<Long> subjectIds,
            @RequestHeader(value = "X-Trace-Id", required = false) String callerTraceId) {
        log.info("Batch evaluation requested. subjects={} callerTraceId={}", subjectIds.size(), callerTraceId);
        return evaluationService.evaluatePopulation(subjectIds, callerTraceId)
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Batch evaluation endpoint error", e));
    }

    @PostMapping("/evaluate/population")
    public Mono<ResponseEntity<PopulationEvaluationSummary>> evaluatePopulation(
            @RequestHeader(value = "X-Trace-Id", required = false) String callerTraceId) {
        log.info("Population evaluation requested. callerTraceId={}", callerTraceId);
        return evaluationService.evaluateEligiblePopulation(callerTraceId)
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Population evaluation endpoint error. callerTraceId={}", callerTraceId, e));
    }

    @GetMapping("/subjects/{id}/patterns")
    public Mono<ResponseEntity<PatternMetrics>> patterns(@PathVariable long id) {
        return notFoundAware(id, evaluationService.analyzePatterns(id));
    }

    // ── Effects ─────────────────────────────────────────────────────────────

    @GetMapping("/subjects/{id}/effects")
    public Mono<ResponseEntity<EffectBundle>> effects(@PathVariable long id) {
        return notFoundAware(id, effectService.effectsFor(id));
    }

    @PostMapping("/subjects/{id}/competition")
    public Mono<ResponseEntity<CompetitionAdjustment>> competition(@PathVariable long id,
                                                                   @RequestBody CompetitionRequest request) {
        if (request.discipline() == null) {
            return Mono.just(ResponseEntity.badRequest().build());
        }
        return notFoundAware(id, effectService.competition(id, request));
    }

    @PostMapping("/subjects/{id}/training")
    public Mono<ResponseEntity<TrainingAdjustment>> training(@PathVariable long id,
                                                             @RequestBody TrainingRequest request) {
        return notFoundAware(id, effectService.training(id, request));
    }

    @PostMapping("/breeding/prediction")
    public Mono<ResponseEntity<BreedingPrediction>> breeding(@RequestBody BreedingRequest request) {
        return effectService.breeding(request)
            .map(ResponseEntity::ok)
            .onErrorResume(SubjectNotFoundException.class, e -> {
                log.warn("Breeding prediction for unknown parent. {}", e.getMessage());
                ResponseEntity<BreedingPrediction> notFound = ResponseEntity.notFound().build();
                return Mono.just(notFound);
            });
    }

    @GetMapping("/definitions")
    public Mono<ResponseEntity<List<FlagDefinitionSummary>>> definitions() {
        return Mono.just(ResponseEntity.ok(effectService.definitions()));
    }

    private <T> Mono<ResponseEntity<T>> notFoundAware(long subjectId, Mono<T> body) {
        return body
            .map(ResponseEntity::ok)
            .onErrorResume(SubjectNotFoundException.class, e -> {
                log.warn("Subject not found. subjectId={}", subjectId);
                ResponseEntity<T> notFound = ResponseEntity.notFound().build();
                return Mono.just(notFound);
            })
            .doOnError(e -> log.error("Flag endpoint error. subjectId={}", subjectId, e));
    }
}
