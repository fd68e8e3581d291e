package com.temperamentplatform.common.model;

/**
 * Classification of a least-squares slope over an interaction series.
 *
 * <p>Bond and quality series use {@link #IMPROVING}/{@link #DECLINING}; the stress series
 * uses {@link #INCREASING}/{@link #DECREASING}. {@link #NO_DATA} is reported for an empty
 * series, {@link #INSUFFICIENT_DATA} for a single point.
 */
public enum TrendDirection {
    IMPROVING,
    DECLINING,
    INCREASING,
    DECREASING,
    STABLE,
    INSUFFICIENT_DATA,
    NO_DATA;

    public boolean hasData() {
        return this != INSUFFICIENT_DATA && this != NO_DATA;
    }
}
