package com.temperamentplatform.common.conflict;

/**
 * How strongly effects are dampened, chosen from the most severe detected conflict.
 */
public enum ResolutionMethod {

    NONE_NEEDED(1.0),
    MINOR_REDUCTION(0.8),
    PARTIAL_CANCELLATION(0.5),
    DOMINANT_FLAG(0.3);

    private final double baseFactor;

    ResolutionMethod(double baseFactor) {
        this.baseFactor = baseFactor;
    }

    public double baseFactor() {
        return baseFactor;
    }

    public static ResolutionMethod forSeverity(double maxSeverity) {
        if (maxSeverity >= 0.8) return DOMINANT_FLAG;
        if (maxSeverity >= 0.5) return PARTIAL_CANCELLATION;
        return MINOR_REDUCTION;
    }
}
