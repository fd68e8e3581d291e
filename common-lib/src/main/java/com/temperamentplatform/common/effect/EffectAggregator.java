package com.temperamentplatform.common.effect;

import com.temperamentplatform.common.conflict.ConflictResolution;
import com.temperamentplatform.common.conflict.ConflictResolver;
import com.temperamentplatform.common.model.Discipline;
import com.temperamentplatform.common.model.EffectProfile;
import com.temperamentplatform.common.model.FlagDefinition;
import com.temperamentplatform.common.registry.FlagDefinitionRegistry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Folds the effect profiles of a subject's flags into one {@link EffectBundle}.
 *
 * <h3>Per known flag</h3>
 * <ul>
 *   <li>general competition bonus, scaled by {@value #GENERAL_BONUS_SCALE}, added to every discipline</li>
 *   <li>per-discipline bonuses and penalties from the profile</li>
 *   <li>negative flags add {@value #NEGATIVE_FLAG_PENALTY} penalty point to every discipline</li>
 *   <li>stress, bonding and training modifiers from the profile, plus a valence adjustment</li>
 *   <li>breeding trait deltas from the profile, plus a delta for the flag's own trait</li>
 * </ul>
 *
 * <p>When the flag set contains conflicts, every numeric field is multiplied by the
 * dampening factor from {@link ConflictResolver}.
 */
public final class EffectAggregator {

    static final double GENERAL_BONUS_SCALE = 10.0;
    static final double NEGATIVE_FLAG_PENALTY = 1.0;

    private static final double POSITIVE_TRAINING = 0.1;
    private static final double POSITIVE_BONDING_BONUS = 0.05;
    private static final double POSITIVE_STRESS_REDUCTION = 0.05;
    private static final double NEGATIVE_TRAINING = -0.1;
    private static final double NEGATIVE_BONDING_DIFFICULTY = 0.05;
    private static final double NEGATIVE_STRESS_INCREASE = 0.05;

    private static final double POSITIVE_SELF_TRAIT = 0.15;
    private static final double NEGATIVE_SELF_TRAIT = 0.10;

    private final FlagDefinitionRegistry registry;
    private final ConflictResolver conflictResolver;

    public EffectAggregator(FlagDefinitionRegistry registry, ConflictResolver conflictResolver) {
        this.registry = registry;
        this.conflictResolver = conflictResolver;
    }

    public EffectBundle aggregate(Collection<String> flags) {
        List<String> requested = new ArrayList<>(new LinkedHashSet<>(flags));
        List<String> known = new ArrayList<>();
        List<String> unknown = new ArrayList<>();

        Map<Discipline, Double> bonuses = new EnumMap<>(Discipline.class);
        Map<Discipline, Double> penalties = new EnumMap<>(Discipline.class);
        Map<String, Double> traits = new LinkedHashMap<>();
        double stressReduction = 0, stressIncrease = 0, stressResistance = 0;
        double bondingBonus = 0, bondingDifficulty = 0, bondingSpeed = 0;
        double training = 0, adaptability = 0;
        int positiveCount = 0;

        for (String name : requested) {
            Optional<FlagDefinition> found = registry.find(name);
            if (found.isEmpty()) {
                unknown.add(name);
                continue;
            }
            known.add(name);
            FlagDefinition def = found.get();
            EffectProfile fx = def.effects();

            if (fx.generalCompetitionBonus() != 0) {
                for (Discipline d : Discipline.values()) {
                    bonuses.merge(d, fx.generalCompetitionBonus() * GENERAL_BONUS_SCALE, Double::sum);
                }
            }
            fx.competitionBonus().forEach((d, pts) -> bonuses.merge(d, pts, Double::sum));
            fx.competitionPenalty().forEach((d, pts) -> penalties.merge(d, pts, Double::sum));

            stressReduction += fx.stressReduction();
            stressIncrease += fx.stressIncrease();
            stressResistance += fx.stressResistance();
            bondingBonus += fx.bondingBonus();
            bondingDifficulty += fx.bondingDifficulty();
            bondingSpeed += fx.bondingSpeed();
            training += fx.trainingEffectiveness();
            adaptability += fx.adaptability();
            fx.traitWeights().forEach((trait, delta) -> traits.merge(trait, delta, Double::sum));

            if (def.isPositive()) {
                positiveCount++;
                training += POSITIVE_TRAINING;
                bondingBonus += POSITIVE_BONDING_BONUS;
                stressReduction += POSITIVE_STRESS_REDUCTION;
                traits.merge(name, POSITIVE_SELF_TRAIT, Double::sum);
            } else {
                for (Discipline d : Discipline.values()) {
                    penalties.merge(d, NEGATIVE_FLAG_PENALTY, Double::sum);
                }
                training += NEGATIVE_TRAINING;
                bondingDifficulty += NEGATIVE_BONDING_DIFFICULTY;
                stressIncrease += NEGATIVE_STRESS_INCREASE;
                traits.merge(name, NEGATIVE_SELF_TRAIT, Double::sum);
            }
        }

        ConflictResolution resolution = conflictResolver.resolve(known);

        StressModifiers stress = new StressModifiers(stressReduction, stressIncrease, stressResistance);
        BondingModifiers bonding = new BondingModifiers(bondingBonus, bondingDifficulty, bondingSpeed);
        TrainingModifiers trainingModifiers = new TrainingModifiers(training, adaptability);

        if (resolution.hasConflicts()) {
            double factor = resolution.dampeningFactor();
            bonuses.replaceAll((d, v) -> v * factor);
            penalties.replaceAll((d, v) -> v * factor);
            traits.replaceAll((t, v) -> v * factor);
            stress = stress.scaled(factor);
            bonding = bonding.scaled(factor);
            trainingModifiers = trainingModifiers.scaled(factor);
        }

        return new EffectBundle(bonuses, penalties, stress, bonding, trainingModifiers, traits,
            known, positiveCount, unknown, resolution);
    }
}
