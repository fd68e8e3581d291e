package com.temperamentplatform.common.registry;

import com.temperamentplatform.common.model.FlagDefinition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, ordered collection of {@link FlagDefinition}s.
 *
 * <p>Constructed once (at service start-up or per test) and passed explicitly into the
 * pipeline; there is no global instance. Iteration order is definition order, which is
 * the order the assignment engine walks.
 *
 * <p>Conflicts are symmetric: {@link #conflicts(String, String)} is true when either
 * definition lists the other.
 *
 * <p>Thread-safe: all state is read-only after construction.
 */
public final class FlagDefinitionRegistry {

    private final Map<String, FlagDefinition> definitions;

    private FlagDefinitionRegistry(Map<String, FlagDefinition> definitions) {
        this.definitions = definitions;
    }

    /**
     * Builds a registry from definitions in the given order.
     *
     * @throws IllegalArgumentException on a duplicate name or a definition that lists itself as a conflict
     */
    public static FlagDefinitionRegistry of(Collection<FlagDefinition> definitions) {
        Map<String, FlagDefinition> ordered = new LinkedHashMap<>();
        for (FlagDefinition def : definitions) {
            if (def.conflictsWith().contains(def.name())) {
                throw new IllegalArgumentException("Flag '" + def.name() + "' cannot conflict with itself");
            }
            if (ordered.putIfAbsent(def.name(), def) != null) {
                throw new IllegalArgumentException("Duplicate flag definition: " + def.name());
            }
        }
        return new FlagDefinitionRegistry(Collections.unmodifiableMap(ordered));
    }

    public static FlagDefinitionRegistry of(FlagDefinition... definitions) {
        return of(List.of(definitions));
    }

    public Optional<FlagDefinition> find(String flagName) {
        return Optional.ofNullable(definitions.get(flagName));
    }

    public boolean contains(String flagName) {
        return definitions.containsKey(flagName);
    }

    /** Definitions in definition order. */
    public List<FlagDefinition> all() {
        return List.copyOf(definitions.values());
    }

    public int size() {
        return definitions.size();
    }

    /** True when either flag's definition lists the other as a conflict. Unknown names never conflict. */
    public boolean conflicts(String first, String second) {
        if (first.equals(second)) return false;
        FlagDefinition a = definitions.get(first);
        FlagDefinition b = definitions.get(second);
        return (a != null && a.conflictsWith().contains(second))
            || (b != null && b.conflictsWith().contains(first));
    }

    /** True when {@code flagName} conflicts with any flag in {@code held}. */
    public boolean conflictsWithAny(String flagName, Collection<String> held) {
        for (String other : held) {
            if (conflicts(flagName, other)) return true;
        }
        return false;
    }

    /** Names from {@code flagNames} that have no definition, in input order. */
    public List<String> unknown(Collection<String> flagNames) {
        List<String> missing = new ArrayList<>();
        for (String name : flagNames) {
            if (!definitions.containsKey(name)) missing.add(name);
        }
        return missing;
    }
}
