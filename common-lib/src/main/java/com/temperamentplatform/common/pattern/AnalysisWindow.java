package com.temperamentplatform.common.pattern;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;

/**
 * Half-open time range {@code [start, end)} over which interactions are analyzed.
 *
 * <p>{@code totalDays} is the window length rounded up to whole days and never less
 * than one, so every ratio computed against it is well defined.
 */
public record AnalysisWindow(
    @JsonProperty("start")     Instant start,
    @JsonProperty("end")       Instant end,
    @JsonProperty("totalDays") int totalDays
) {

    private static final long DAY_MILLIS = Duration.ofDays(1).toMillis();

    public AnalysisWindow {
        if (end.isBefore(start)) {
            end = start;
        }
        totalDays = Math.max(1, totalDays);
    }

    public static AnalysisWindow between(Instant start, Instant end) {
        Instant effectiveEnd = end.isBefore(start) ? start : end;
        long millis = Duration.between(start, effectiveEnd).toMillis();
        int days = (int) Math.max(1, (millis + DAY_MILLIS - 1) / DAY_MILLIS);
        return new AnalysisWindow(start, effectiveEnd, days);
    }

    /**
     * Window for a subject evaluated at {@code asOf}:
     * {@code [max(birth, asOf - windowDays), min(asOf, birth + maturityCutoff))}.
     * Collapses to an empty window once the subject is past the cutoff.
     */
    public static AnalysisWindow forSubject(Instant birthDate, Instant asOf, AnalysisSettings settings) {
        Instant lookback = asOf.minus(Duration.ofDays(settings.windowDays()));
        Instant cutoff = birthDate.plus(Duration.ofDays(settings.maturityCutoffDays()));
        Instant start = lookback.isAfter(birthDate) ? lookback : birthDate;
        Instant end = asOf.isBefore(cutoff) ? asOf : cutoff;
        return between(start, end);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return !end.isAfter(start);
    }

    /** Zero-based day index of {@code instant} relative to {@link #start()}. */
    public int dayIndex(Instant instant) {
        return (int) Math.floorDiv(Duration.between(start, instant).toMillis(), DAY_MILLIS);
    }
}
