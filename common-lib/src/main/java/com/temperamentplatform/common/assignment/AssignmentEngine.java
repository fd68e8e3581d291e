package com.temperamentplatform.common.assignment;

import com.temperamentplatform.common.model.FlagDefinition;
import com.temperamentplatform.common.model.SubjectState;
import com.temperamentplatform.common.registry.FlagDefinitionRegistry;
import com.temperamentplatform.common.trigger.TriggerVerdict;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns trigger verdicts into the list of flags to append.
 *
 * <p>Walks the registry in definition order and, for each flag:
 * <ol>
 *   <li>skips it if the subject already holds it;</li>
 *   <li>stops accepting once {@value SubjectState#MAX_FLAGS} flags are held;</li>
 *   <li>skips it if it conflicts with a held flag or one accepted earlier in this run;</li>
 *   <li>skips it if its verdict is missing or not triggered;</li>
 *   <li>otherwise accepts it.</li>
 * </ol>
 *
 * <p>The engine never removes a flag. Pure function.
 */
public final class AssignmentEngine {

    private AssignmentEngine() { /* utility class */ }

    public static AssignmentDecision decide(FlagDefinitionRegistry registry,
                                            Collection<String> currentFlags,
                                            Map<String, TriggerVerdict> verdicts) {
        Set<String> held = new LinkedHashSet<>(currentFlags);
        List<String> accepted = new ArrayList<>();
        Map<String, TriggerVerdict> evidence = new LinkedHashMap<>();
        Map<String, SkipReason> skipped = new LinkedHashMap<>();

        for (FlagDefinition def : registry.all()) {
            String name = def.name();

            if (held.contains(name)) {
                skipped.put(name, SkipReason.ALREADY_ASSIGNED);
                continue;
            }
            if (held.size() + accepted.size() >= SubjectState.MAX_FLAGS) {
                skipped.put(name, SkipReason.CAPACITY_REACHED);
                continue;
            }
            if (registry.conflictsWithAny(name, held)) {
                skipped.put(name, SkipReason.CONFLICTS_WITH_CURRENT);
                continue;
            }
            if (registry.conflictsWithAny(name, accepted)) {
                skipped.put(name, SkipReason.CONFLICTS_WITH_NEW);
                continue;
            }

            TriggerVerdict verdict = verdicts.get(name);
            if (verdict == null || !verdict.triggered()) {
                skipped.put(name, SkipReason.NOT_TRIGGERED);
                continue;
            }

            accepted.add(name);
            evidence.put(name, verdict);
        }

        Set<String> resulting = new LinkedHashSet<>(held);
        resulting.addAll(accepted);
        return new AssignmentDecision(accepted, evidence, skipped, resulting);
    }
}
