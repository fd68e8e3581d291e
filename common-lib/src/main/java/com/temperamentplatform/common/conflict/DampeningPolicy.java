package com.temperamentplatform.common.conflict;

/**
 * Converts a resolution method and conflict count into a dampening factor:
 * {@code max(floor, method.baseFactor - min(maxCountReduction, n * perConflictReduction))}.
 */
public record DampeningPolicy(double floor, double perConflictReduction, double maxCountReduction) {

    public static final DampeningPolicy DEFAULTS = new DampeningPolicy(0.2, 0.1, 0.3);

    public double factor(ResolutionMethod method, int conflictCount) {
        if (method == ResolutionMethod.NONE_NEEDED || conflictCount == 0) return 1.0;
        double countReduction = Math.min(maxCountReduction, conflictCount * perConflictReduction);
        return Math.max(floor, method.baseFactor() - countReduction);
    }
}
