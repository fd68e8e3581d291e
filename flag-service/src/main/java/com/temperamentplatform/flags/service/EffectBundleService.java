package com.temperamentplatform.flags.service;

import com.temperamentplatform.common.effect.BreedingEffectCalculator;
import com.temperamentplatform.common.effect.BreedingPrediction;
import com.temperamentplatform.common.effect.CompetitionAdjustment;
import com.temperamentplatform.common.effect.CompetitionEffectCalculator;
import com.temperamentplatform.common.effect.EffectAggregator;
import com.temperamentplatform.common.effect.EffectBundle;
import com.temperamentplatform.common.effect.TrainingAdjustment;
import com.temperamentplatform.common.effect.TrainingEffectCalculator;
import com.temperamentplatform.common.model.FlagDefinition;
import com.temperamentplatform.common.registry.FlagDefinitionRegistry;
import com.temperamentplatform.common.trigger.TriggerRuleRegistry;
import com.temperamentplatform.flags.dto.BreedingRequest;
import com.temperamentplatform.flags.dto.CompetitionRequest;
import com.temperamentplatform.flags.dto.FlagDefinitionSummary;
import com.temperamentplatform.flags.dto.TrainingRequest;
import com.temperamentplatform.flags.exception.SubjectNotFoundException;
import com.temperamentplatform.flags.store.SubjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Serves the downstream view of a subject's flags: the aggregated effect bundle and the
 * competition, training and breeding adjustments derived from it.
 */
@Service
public class EffectBundleService {

    private static final Logger log = LoggerFactory.getLogger(EffectBundleService.class);

    private final SubjectStore subjectStore;
    private final EffectAggregator aggregator;
    private final BreedingEffectCalculator breedingCalculator;
    private final FlagDefinitionRegistry registry;
    private final TriggerRuleRegistry rules;

    public EffectBundleService(SubjectStore subjectStore,
                               EffectAggregator aggregator,
                               BreedingEffectCalculator breedingCalculator,
                               FlagDefinitionRegistry registry,
                               TriggerRuleRegistry rules) {
        this.subjectStore       = subjectStore;
        this.aggregator         = aggregator;
        this.breedingCalculator = breedingCalculator;
        this.registry           = registry;
        this.rules              = rules;
    }

    public Mono<EffectBundle> effectsFor(long subjectId) {
        return subjectStore.getSubject(subjectId)
            .switchIfEmpty(Mono.error(new SubjectNotFoundException(subjectId)))
            .map(subject -> {
                EffectBundle bundle = aggregator.aggregate(subject.flags());
                if (!bundle.unknownFlags().isEmpty()) {
                    log.warn("Undefined flags excluded from effects. subjectId={} flags={}",
                             subjectId, bundle.unknownFlags());
                }
                return bundle;
            });
    }

    public Mono<CompetitionAdjustment> competition(long subjectId, CompetitionRequest request) {
        return effectsFor(subjectId)
            .map(bundle -> CompetitionEffectCalculator.apply(bundle, request.discipline(), request.baseScore()));
    }

    public Mono<TrainingAdjustment> training(long subjectId, TrainingRequest request) {
        return effectsFor(subjectId)
            .map(bundle -> TrainingEffectCalculator.apply(
                bundle, request.baseEffectiveness(), request.caregiverPersonality()));
    }

    public Mono<BreedingPrediction> breeding(BreedingRequest request) {
        return Mono.zip(effectsFor(request.damId()), effectsFor(request.sireId()))
            .map(parents -> breedingCalculator.predict(parents.getT1(), parents.getT2(), request.baseProbabilities()))
            .doOnNext(p -> log.info("Breeding prediction. damId={} sireId={} conflicts={} inherited={}",
                                       request.damId(), request.sireId(),
                                       p.parentConflicts().conflicts().size(), p.inheritedTraits()));
    }

    public List<FlagDefinitionSummary> definitions() {
        return registry.all().stream()
            .map(this::summarize)
            .toList();
    }

    private FlagDefinitionSummary summarize(FlagDefinition definition) {
        return new FlagDefinitionSummary(
            definition.name(),
            definition.displayName(),
            definition.valence(),
            definition.baseThreshold(),
            definition.conflictsWith().stream().sorted().toList(),
            rules.hasSpecializedRule(definition.name()));
    }
}
