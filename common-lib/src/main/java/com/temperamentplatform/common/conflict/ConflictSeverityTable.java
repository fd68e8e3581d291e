package com.temperamentplatform.common.conflict;

import java.util.HashMap;
import java.util.Map;

/**
 * Severity of each conflicting flag pair. Pairs are unordered.
 */
public final class ConflictSeverityTable {

    public static final double DEFAULT_SEVERITY = 0.5;

    private final Map<String, Double> severities;
    private final double defaultSeverity;

    private ConflictSeverityTable(Map<String, Double> severities, double defaultSeverity) {
        this.severities = Map.copyOf(severities);
        this.defaultSeverity = defaultSeverity;
    }

    public static ConflictSeverityTable standard() {
        return builder()
            .pair("brave", "fearful", 0.9)
            .pair("confident", "insecure", 0.8)
            .pair("social", "antisocial", 0.8)
            .pair("calm", "reactive", 0.7)
            .pair("resilient", "fragile", 0.7)
            .build();
    }

    public double severity(String first, String second) {
        return severities.getOrDefault(key(first, second), defaultSeverity);
    }

    private static String key(String a, String b) {
        return a.compareTo(b) <= 0 ? a + '|' + b : b + '|' + a;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private final Map<String, Double> severities = new HashMap<>();
        private double defaultSeverity = DEFAULT_SEVERITY;

        private Builder() {}

        public Builder pair(String first, String second, double severity) {
            severities.put(key(first, second), severity);
            return this;
        }

        public Builder defaultSeverity(double severity) {
            this.defaultSeverity = severity;
            return this;
        }

        public ConflictSeverityTable build() {
            return new ConflictSeverityTable(severities, defaultSeverity);
        }
    }
}
