package com.temperamentplatform.common.pattern;

/**
 * Window configuration for the pattern analyzer.
 *
 * @param windowDays         how far back from the evaluation instant interactions are considered
 * @param maturityCutoffDays subject age after which interactions no longer count
 */
public record AnalysisSettings(int windowDays, int maturityCutoffDays) {

    public static final int DEFAULT_WINDOW_DAYS = 30;
    public static final int DEFAULT_MATURITY_CUTOFF_DAYS = 1095;

    public static final AnalysisSettings DEFAULTS =
        new AnalysisSettings(DEFAULT_WINDOW_DAYS, DEFAULT_MATURITY_CUTOFF_DAYS);

    public AnalysisSettings {
        if (windowDays <= 0) {
            throw new IllegalArgumentException("windowDays must be positive, got " + windowDays);
        }
        if (maturityCutoffDays <= 0) {
            throw new IllegalArgumentException("maturityCutoffDays must be positive, got " + maturityCutoffDays);
        }
    }
}
