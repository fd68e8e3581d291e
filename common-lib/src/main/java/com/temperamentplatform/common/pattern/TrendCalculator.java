package com.temperamentplatform.common.pattern;

import com.temperamentplatform.common.model.TrendDirection;

import java.util.List;

/**
 * Ordinary least-squares slope over a series, with x = position in the series.
 *
 * <p>Slopes whose magnitude does not exceed {@value #STABILITY_EPSILON} are reported as
 * {@link TrendDirection#STABLE}. An empty series is {@link TrendDirection#NO_DATA};
 * a single point is {@link TrendDirection#INSUFFICIENT_DATA}.
 */
public final class TrendCalculator {

    public static final double STABILITY_EPSILON = 0.1;

    private TrendCalculator() { /* utility class */ }

    /** Bond and quality series: rising is {@code IMPROVING}. */
    public static Trend improvementTrend(List<Double> series) {
        return classify(series, TrendDirection.IMPROVING, TrendDirection.DECLINING);
    }

    /** Stress series: rising is {@code INCREASING}. */
    public static Trend levelTrend(List<Double> series) {
        return classify(series, TrendDirection.INCREASING, TrendDirection.DECREASING);
    }

    public static Trend classify(List<Double> series, TrendDirection rising, TrendDirection falling) {
        if (series == null || series.isEmpty()) {
            return new Trend(TrendDirection.NO_DATA, 0.0, 0);
        }
        if (series.size() < 2) {
            return new Trend(TrendDirection.INSUFFICIENT_DATA, 0.0, 1);
        }

        double slope = slope(series);
        TrendDirection direction;
        if (slope > STABILITY_EPSILON) {
            direction = rising;
        } else if (slope < -STABILITY_EPSILON) {
            direction = falling;
        } else {
            direction = TrendDirection.STABLE;
        }
        return new Trend(direction, slope, series.size());
    }

    /** Least-squares slope; 0.0 for fewer than two points. */
    public static double slope(List<Double> series) {
        int n = series.size();
        if (n < 2) return 0.0;

        double sumX = 0, sumY = 0, sumXY = 0, sumX2 = 0;
        for (int i = 0; i < n; i++) {
            double y = series.get(i);
            sumX += i;
            sumY += y;
            sumXY += i * y;
            sumX2 += (double) i * i;
        }

        double denominator = n * sumX2 - sumX * sumX;
        if (denominator == 0) return 0.0;

        return (n * sumXY - sumX * sumY) / denominator;
    }
}
