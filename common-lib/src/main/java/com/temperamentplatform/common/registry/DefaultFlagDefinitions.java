package com.temperamentplatform.common.registry;

import com.temperamentplatform.common.model.Discipline;
import com.temperamentplatform.common.model.EffectProfile;
import com.temperamentplatform.common.model.FlagDefinition;
import com.temperamentplatform.common.model.FlagValence;

import java.util.List;
import java.util.Set;

/**
 * The standard flag rule set shipped with the platform.
 *
 * <p>Numbers here are game-balance defaults. Callers that need a different balance build
 * their own {@link FlagDefinitionRegistry}; nothing reads these constants directly.
 */
public final class DefaultFlagDefinitions {

    public static final String BRAVE        = "brave";
    public static final String CONFIDENT    = "confident";
    public static final String AFFECTIONATE = "affectionate";
    public static final String RESILIENT    = "resilient";
    public static final String CALM         = "calm";
    public static final String SOCIAL       = "social";
    public static final String CURIOUS      = "curious";
    public static final String FEARFUL      = "fearful";
    public static final String INSECURE     = "insecure";
    public static final String ANTISOCIAL   = "antisocial";
    public static final String FRAGILE      = "fragile";
    public static final String REACTIVE     = "reactive";
    public static final String ALOOF        = "aloof";

    private DefaultFlagDefinitions() {}

    public static FlagDefinitionRegistry standard() {
        return FlagDefinitionRegistry.of(definitions());
    }

    public static List<FlagDefinition> definitions() {
        return List.of(
            // ── positive ────────────────────────────────────────────────
            positive(BRAVE, "Brave", Set.of(FEARFUL, INSECURE), EffectProfile.builder()
                .competitionBonus(Discipline.SHOW_JUMPING, 2)
                .competitionBonus(Discipline.CROSS_COUNTRY, 3)
                .stressResistance(0.3)
                .adaptability(0.1)
                .traitWeight("fearless", 0.3)
                .traitWeight("bold", 0.2)
                .build()),
            positive(CONFIDENT, "Confident", Set.of(INSECURE, FEARFUL), EffectProfile.builder()
                .generalCompetitionBonus(0.05)
                .competitionBonus(Discipline.DRESSAGE, 2)
                .competitionBonus(Discipline.RACING, 1)
                .stressResistance(0.2)
                .trainingEffectiveness(0.1)
                .traitWeight("composed", 0.2)
                .traitWeight("self_assured", 0.25)
                .build()),
            positive(AFFECTIONATE, "Affectionate", Set.of(ANTISOCIAL, ALOOF), EffectProfile.builder()
                .bondingBonus(0.25)
                .bondingSpeed(0.2)
                .traitWeight("bonded", 0.25)
                .traitWeight("trusting", 0.2)
                .build()),
            positive(RESILIENT, "Resilient", Set.of(FRAGILE), EffectProfile.builder()
                .stressReduction(0.3)
                .stressResistance(0.3)
                .adaptability(0.2)
                .traitWeight("hardy", 0.25)
                .traitWeight("adaptable", 0.2)
                .build()),
            positive(CALM, "Calm", Set.of(REACTIVE), EffectProfile.builder()
                .competitionBonus(Discipline.DRESSAGE, 1.5)
                .stressReduction(0.2)
                .trainingEffectiveness(0.05)
                .traitWeight("composed", 0.15)
                .build()),
            positive(SOCIAL, "Social", Set.of(ANTISOCIAL, ALOOF), EffectProfile.builder()
                .generalCompetitionBonus(0.02)
                .bondingSpeed(0.1)
                .traitWeight("friendly", 0.25)
                .traitWeight("outgoing", 0.2)
                .build()),
            positive(CURIOUS, "Curious", Set.of(), EffectProfile.builder()
                .adaptability(0.15)
                .trainingEffectiveness(0.05)
                .traitWeight("inquisitive", 0.2)
                .build()),
            // ── negative ────────────────────────────────────────────────
            negative(FEARFUL, "Fearful", Set.of(BRAVE, CONFIDENT), EffectProfile.builder()
                .competitionPenalty(Discipline.SHOW_JUMPING, 2)
                .competitionPenalty(Discipline.CROSS_COUNTRY, 3)
                .stressIncrease(0.2)
                .traitWeight("nervous", 0.3)
                .traitWeight("skittish", 0.25)
                .build()),
            negative(INSECURE, "Insecure", Set.of(CONFIDENT, BRAVE), EffectProfile.builder()
                .bondingDifficulty(0.2)
                .trainingEffectiveness(-0.05)
                .traitWeight("dependent", 0.2)
                .traitWeight("anxious", 0.15)
                .build()),
            negative(ANTISOCIAL, "Antisocial", Set.of(AFFECTIONATE, SOCIAL), EffectProfile.builder()
                .bondingDifficulty(0.3)
                .traitWeight("aloof", 0.25)
                .traitWeight("independent", 0.2)
                .build()),
            negative(FRAGILE, "Fragile", Set.of(RESILIENT), EffectProfile.builder()
                .competitionPenalty(Discipline.ENDURANCE, 2)
                .stressIncrease(0.25)
                .traitWeight("delicate", 0.2)
                .build()),
            negative(REACTIVE, "Reactive", Set.of(CALM), EffectProfile.builder()
                .competitionPenalty(Discipline.DRESSAGE, 1.5)
                .stressIncrease(0.15)
                .traitWeight("high_strung", 0.2)
                .build()),
            negative(ALOOF, "Aloof", Set.of(AFFECTIONATE, SOCIAL), EffectProfile.builder()
                .bondingDifficulty(0.15)
                .traitWeight("independent", 0.15)
                .build())
        );
    }

    private static FlagDefinition positive(String name, String displayName,
                                           Set<String> conflicts, EffectProfile effects) {
        return new FlagDefinition(name, displayName, FlagValence.POSITIVE,
            FlagDefinition.DEFAULT_BASE_THRESHOLD, conflicts, effects);
    }

    private static FlagDefinition negative(String name, String displayName,
                                           Set<String> conflicts, EffectProfile effects) {
        return new FlagDefinition(name, displayName, FlagValence.NEGATIVE,
            FlagDefinition.DEFAULT_BASE_THRESHOLD, conflicts, effects);
    }
}
