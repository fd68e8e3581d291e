package com.temperamentplatform.common.trigger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RuleOutcomeTest {

    @Test
    @DisplayName("allOf is satisfied only when every check holds")
    void allOfMet() {
        RuleOutcome outcome = RuleOutcome.checks()
            .check("a", true)
            .check("b", true)
            .allOf("all good");

        assertTrue(outcome.satisfied());
        assertEquals("all good", outcome.reason());
    }

    @Test
    @DisplayName("allOf lists failing checks in evaluation order")
    void allOfFailing() {
        RuleOutcome outcome = RuleOutcome.checks()
            .check("a", false)
            .check("ok", true)
            .check("b", false)
            .allOf("unused");

        assertFalse(outcome.satisfied());
        assertEquals("Conditions not met: a, b", outcome.reason());
    }

    @Test
    @DisplayName("anyOf needs one passing check")
    void anyOf() {
        assertTrue(RuleOutcome.checks().check("a", false).check("b", true).anyOf("one").satisfied());

        RuleOutcome none = RuleOutcome.checks().check("a", false).anyOf("one");
        assertFalse(none.satisfied());
        assertEquals("No condition met", none.reason());
    }

    @Test
    @DisplayName("conditions accessor returns the recorded checks in order")
    void conditionsAccessor() {
        RuleOutcome outcome = RuleOutcome.checks()
            .check("first", true)
            .check("second", false)
            .allOf("unused");

        Map<String, Boolean> conditions = outcome.conditions();
        assertEquals(List.of("first", "second"), List.copyOf(conditions.keySet()));
        assertEquals(Boolean.FALSE, conditions.get("second"));
        assertThrows(UnsupportedOperationException.class, () -> conditions.put("third", true));
    }

    @Test
    @DisplayName("outcome is detached from the caller's map")
    void defensiveCopy() {
        Map<String, Boolean> source = new HashMap<>();
        source.put("a", true);
        RuleOutcome outcome = new RuleOutcome(true, "ok", source);
        source.put("b", false);

        assertEquals(1, outcome.conditions().size());
        assertTrue(new RuleOutcome(false, "none", null).conditions().isEmpty());
    }
}
