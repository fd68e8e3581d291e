package com.temperamentplatform.flags.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.temperamentplatform.common.conflict.ConflictResolver;
import com.temperamentplatform.common.conflict.ConflictSeverityTable;
import com.temperamentplatform.common.conflict.DampeningPolicy;
import com.temperamentplatform.common.effect.BreedingEffectCalculator;
import com.temperamentplatform.common.effect.EffectAggregator;
import com.temperamentplatform.common.pattern.AnalysisSettings;
import com.temperamentplatform.common.pipeline.FlagEvaluationPipeline;
import com.temperamentplatform.common.registry.DefaultFlagDefinitions;
import com.temperamentplatform.common.registry.FlagDefinitionRegistry;
import com.temperamentplatform.common.trigger.TriggerEvaluator;
import com.temperamentplatform.common.trigger.TriggerRuleRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.random.RandomGenerator;

@Configuration
public class FlagServiceConfig {

    @Value("${flags.analysis.window-days:30}")
    private int windowDays;

    @Value("${flags.analysis.maturity-cutoff-days:1095}")
    private int maturityCutoffDays;

    @Bean
    public FlagDefinitionRegistry flagDefinitionRegistry() {
        return DefaultFlagDefinitions.standard();
    }

    @Bean
    public TriggerRuleRegistry triggerRuleRegistry() {
        return TriggerRuleRegistry.standard();
    }

    @Bean
    public AnalysisSettings analysisSettings() {
        return new AnalysisSettings(windowDays, maturityCutoffDays);
    }

    @Bean
    public TriggerEvaluator triggerEvaluator(FlagDefinitionRegistry registry, TriggerRuleRegistry rules) {
        return new TriggerEvaluator(registry, rules);
    }

    @Bean
    public ConflictResolver conflictResolver(FlagDefinitionRegistry registry) {
        return new ConflictResolver(registry, ConflictSeverityTable.standard(), DampeningPolicy.DEFAULTS);
    }

    @Bean
    public FlagEvaluationPipeline flagEvaluationPipeline(FlagDefinitionRegistry registry,
                                                         TriggerEvaluator triggerEvaluator,
                                                         ConflictResolver conflictResolver,
                                                         AnalysisSettings settings) {
        return new FlagEvaluationPipeline(registry, triggerEvaluator, conflictResolver, settings);
    }

    @Bean
    public EffectAggregator effectAggregator(FlagDefinitionRegistry registry, ConflictResolver conflictResolver) {
        return new EffectAggregator(registry, conflictResolver);
    }

    @Bean
    public BreedingEffectCalculator breedingEffectCalculator(ConflictResolver conflictResolver) {
        return new BreedingEffectCalculator(conflictResolver, RandomGenerator.getDefault());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }
}
