package com.temperamentplatform.common.trigger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of a trigger rule before the pattern-strength gate is applied.
 *
 * @param conditions named sub-conditions in evaluation order
 */
public record RuleOutcome(boolean satisfied, String reason, Map<String, Boolean> conditions) {

    public RuleOutcome {
        conditions = conditions == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(conditions));
    }

    public static Conditions checks() {
        return new Conditions();
    }

    /** Collects named checks and combines them into a {@link RuleOutcome}. */
    public static final class Conditions {

        private final Map<String, Boolean> checks = new LinkedHashMap<>();

        private Conditions() {}

        public Conditions check(String name, boolean value) {
            checks.put(name, value);
            return this;
        }

        /** Satisfied when every check holds. */
        public RuleOutcome allOf(String reasonWhenMet) {
            boolean met = checks.values().stream().allMatch(Boolean::booleanValue);
            return new RuleOutcome(met, met ? reasonWhenMet : "Conditions not met: " + failing(), checks);
        }

        /** Satisfied when at least one check holds. */
        public RuleOutcome anyOf(String reasonWhenMet) {
            boolean met = checks.values().stream().anyMatch(Boolean::booleanValue);
            return new RuleOutcome(met, met ? reasonWhenMet : "No condition met", checks);
        }

        private String failing() {
            List<String> names = new ArrayList<>();
            checks.forEach((name, ok) -> { if (!ok) names.add(name); });
            return String.join(", ", names);
        }
    }
}
