package com.temperamentplatform.common.registry;

import com.temperamentplatform.common.model.FlagDefinition;
import com.temperamentplatform.common.model.FlagValence;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FlagDefinitionRegistryTest {

    private static FlagDefinition flag(String name, FlagValence valence, String... conflicts) {
        return new FlagDefinition(name, name, valence, 0.5, Set.of(conflicts), null);
    }

    @Test
    @DisplayName("conflicts are symmetric even when declared on one side only")
    void symmetricConflicts() {
        FlagDefinitionRegistry registry = FlagDefinitionRegistry.of(
            flag("bold", FlagValence.POSITIVE, "timid"),
            flag("timid", FlagValence.NEGATIVE));

        assertTrue(registry.conflicts("bold", "timid"));
        assertTrue(registry.conflicts("timid", "bold"));
        assertFalse(registry.conflicts("bold", "bold"));
        assertFalse(registry.conflicts("bold", "unknown"));
    }

    @Test
    @DisplayName("definition order is preserved")
    void orderPreserved() {
        FlagDefinitionRegistry registry = FlagDefinitionRegistry.of(
            flag("c", FlagValence.POSITIVE), flag("a", FlagValence.POSITIVE), flag("b", FlagValence.NEGATIVE));
        assertEquals(List.of("c", "a", "b"), registry.all().stream().map(FlagDefinition::name).toList());
    }

    @Test
    @DisplayName("duplicate names and self-conflicts are rejected")
    void rejectsInvalid() {
        assertThrows(IllegalArgumentException.class, () -> FlagDefinitionRegistry.of(
            flag("a", FlagValence.POSITIVE), flag("a", FlagValence.NEGATIVE)));
        assertThrows(IllegalArgumentException.class, () -> FlagDefinitionRegistry.of(
            flag("a", FlagValence.POSITIVE, "a")));
    }

    @Test
    @DisplayName("unknown() lists names without a definition")
    void unknownNames() {
        FlagDefinitionRegistry registry = DefaultFlagDefinitions.standard();
        assertEquals(List.of("mystery"), registry.unknown(List.of("brave", "mystery")));
    }

    @Test
    @DisplayName("standard set: every declared conflict names a defined flag")
    void standardConflictsResolve() {
        FlagDefinitionRegistry registry = DefaultFlagDefinitions.standard();
        for (FlagDefinition def : registry.all()) {
            for (String other : def.conflictsWith()) {
                assertTrue(registry.contains(other), def.name() + " conflicts with undefined " + other);
            }
        }
        assertTrue(registry.conflicts("brave", "fearful"));
        assertTrue(registry.conflicts("affectionate", "aloof"));
        assertFalse(registry.conflicts("brave", "calm"));
    }
}
