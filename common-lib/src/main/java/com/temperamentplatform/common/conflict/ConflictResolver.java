package com.temperamentplatform.common.conflict;

import com.temperamentplatform.common.registry.FlagDefinitionRegistry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Detects conflicting pairs in a flag set and derives a dampening factor for effects.
 *
 * <p>Assignment never creates a conflicting pair on one subject, so conflicts show up
 * when sets are combined (for example both parents in a breeding prediction) or when
 * stored data predates a rule change.
 */
public final class ConflictResolver {

    private final FlagDefinitionRegistry registry;
    private final ConflictSeverityTable severities;
    private final DampeningPolicy policy;

    public ConflictResolver(FlagDefinitionRegistry registry,
                            ConflictSeverityTable severities,
                            DampeningPolicy policy) {
        this.registry = registry;
        this.severities = severities;
        this.policy = policy;
    }

    public ConflictResolution resolve(Collection<String> currentFlags, Collection<String> proposedFlags) {
        LinkedHashSet<String> union = new LinkedHashSet<>(currentFlags);
        union.addAll(proposedFlags);
        return resolve(union);
    }

    public ConflictResolution resolve(Collection<String> flags) {
        List<String> distinct = new ArrayList<>(new LinkedHashSet<>(flags));
        List<FlagConflict> conflicts = new ArrayList<>();

        for (int i = 0; i < distinct.size(); i++) {
            for (int j = i + 1; j < distinct.size(); j++) {
                String a = distinct.get(i);
                String b = distinct.get(j);
                if (registry.conflicts(a, b)) {
                    conflicts.add(new FlagConflict(a, b, severities.severity(a, b)));
                }
            }
        }

        if (conflicts.isEmpty()) return ConflictResolution.NONE;

        double maxSeverity = conflicts.stream().mapToDouble(FlagConflict::severity).max().orElse(0.0);
        ResolutionMethod method = ResolutionMethod.forSeverity(maxSeverity);
        return new ConflictResolution(conflicts, method, policy.factor(method, conflicts.size()));
    }
}
