package com.temperamentplatform.common.pattern;

import com.temperamentplatform.common.model.InteractionEvent;
import com.temperamentplatform.common.model.QualityGrade;

import java.time.Duration;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Weighted multi-factor scores layered on top of the basic pattern metrics: a consistency
 * breakdown, a care-risk assessment and per-caregiver effectiveness.
 *
 * <p>All methods expect the in-window events in chronological order, as produced by
 * {@link PatternAnalyzer#inWindowChronological}. Pure functions, no Spring dependencies.
 */
public final class CareScoring {

    // ── Consistency weights ────────────────────────────────────────
    private static final double W_FREQUENCY = 0.25;
    private static final double W_QUALITY = 0.30;
    private static final double W_DURATION = 0.15;
    private static final double W_CAREGIVER = 0.20;
    private static final double W_TIMING = 0.10;

    private static final double MAX_QUALITY_STD_DEV = 1.5;
    private static final double MAX_HOUR_STD_DEV = 6.0;
    private static final double SINGLE_SAMPLE_SCORE = 0.8;
    private static final int DEFAULT_DURATION_MINUTES = 30;

    // ── Risk weights ───────────────────────────────────────────────
    private static final double R_CONSISTENCY = 0.25;
    private static final double R_QUALITY = 0.30;
    private static final double R_FREQUENCY = 0.20;
    private static final double R_CAREGIVER = 0.15;
    private static final double R_STRESS = 0.10;

    private static final double EXPECTED_DAILY_COVERAGE = 0.3;
    private static final double SPIKE_TOLERANCE = 0.2;
    private static final double NEUTRAL_STRESS_RISK = 0.5;
    static final double RECOMMENDATION_THRESHOLD = 0.6;

    static final String CONSISTENCY_ADVICE = "Improve care consistency by establishing regular interaction schedules.";
    static final String QUALITY_ADVICE = "Focus on improving interaction quality through better training or caregiver selection.";
    static final String FREQUENCY_ADVICE = "Increase frequency of interactions to ensure adequate care coverage.";
    static final String CAREGIVER_ADVICE = "Reduce caregiver changes to provide more stable care relationships.";
    static final String STRESS_ADVICE = "Address stress-inducing factors and improve stress management techniques.";
    static final String ALL_CLEAR = "Care patterns appear to be within acceptable risk levels.";

    private CareScoring() { /* utility class */ }

    // ── Consistency breakdown ──────────────────────────────────────

    public static ConsistencyBreakdown consistencyBreakdown(List<InteractionEvent> events) {
        if (events.isEmpty()) return ConsistencyBreakdown.empty();

        double frequency = frequencyConsistency(events);
        double quality = qualityConsistency(events);
        double duration = durationConsistency(events);
        double caregiver = caregiverConsistency(events);
        double timing = timingConsistency(events);

        double overall = frequency * W_FREQUENCY
            + quality * W_QUALITY
            + duration * W_DURATION
            + caregiver * W_CAREGIVER
            + timing * W_TIMING;
        return new ConsistencyBreakdown(overall, frequency, quality, duration, caregiver, timing, events.size());
    }

    static double frequencyConsistency(List<InteractionEvent> events) {
        if (events.size() < 2) return 0.0;
        List<Double> intervals = new ArrayList<>();
        for (int i = 1; i < events.size(); i++) {
            Duration gap = Duration.between(events.get(i - 1).occurredAt(), events.get(i).occurredAt());
            intervals.add(gap.toMillis() / (double) Duration.ofDays(1).toMillis());
        }
        return 1.0 - Math.min(coefficientOfVariation(intervals), 1.0);
    }

    static double qualityConsistency(List<InteractionEvent> events) {
        if (events.isEmpty()) return 0.0;
        List<Double> scores = qualityScores(events);
        if (scores.size() == 1) return scores.get(0) / QualityGrade.EXCELLENT.score();
        return clamp01(1.0 - stdDev(scores) / MAX_QUALITY_STD_DEV);
    }

    static double durationConsistency(List<InteractionEvent> events) {
        if (events.isEmpty()) return 0.0;
        if (events.size() < 2) return SINGLE_SAMPLE_SCORE;
        List<Double> durations = events.stream()
            .map(e -> (double) (e.durationMinutes() > 0 ? e.durationMinutes() : DEFAULT_DURATION_MINUTES))
            .toList();
        return Math.max(0.0, 1.0 - Math.min(coefficientOfVariation(durations) * 2, 1.0));
    }

    static double caregiverConsistency(List<InteractionEvent> events) {
        if (events.isEmpty()) return 0.0;
        int changes = distinctCaregivers(events) - 1;
        double allowed = Math.max(1.0, events.size() / 3.0);
        return clamp01(1.0 - changes / allowed);
    }

    static double timingConsistency(List<InteractionEvent> events) {
        if (events.size() < 2) return SINGLE_SAMPLE_SCORE;
        List<Double> hours = events.stream()
            .map(e -> (double) e.occurredAt().atZone(ZoneOffset.UTC).getHour())
            .toList();
        return clamp01(1.0 - stdDev(hours) / MAX_HOUR_STD_DEV);
    }

    // ── Care risk ──────────────────────────────────────────────────

    public static CareRisk careRisk(List<InteractionEvent> events, AnalysisWindow window) {
        double consistencyRisk = events.isEmpty()
            ? 1.0
            : 1.0 - (frequencyConsistency(events) + qualityConsistency(events)) / 2;
        double qualityRisk = events.isEmpty()
            ? 1.0
            : Math.max(0.0, 1.0 - normalisedQuality(mean(qualityScores(events))));
        double expected = window.totalDays() * EXPECTED_DAILY_COVERAGE;
        double frequencyRisk = Math.max(0.0, 1.0 - Math.min(events.size() / expected, 1.0));
        double caregiverRisk = events.isEmpty()
            ? 1.0
            : Math.min(1.0, (distinctCaregivers(events) - 1) / Math.max(1.0, events.size() / 5.0));
        double stressRisk = stressRisk(events);

        double overall = consistencyRisk * R_CONSISTENCY
            + qualityRisk * R_QUALITY
            + frequencyRisk * R_FREQUENCY
            + caregiverRisk * R_CAREGIVER
            + stressRisk * R_STRESS;

        List<String> advice = new ArrayList<>();
        if (consistencyRisk > RECOMMENDATION_THRESHOLD) advice.add(CONSISTENCY_ADVICE);
        if (qualityRisk > RECOMMENDATION_THRESHOLD) advice.add(QUALITY_ADVICE);
        if (frequencyRisk > RECOMMENDATION_THRESHOLD) advice.add(FREQUENCY_ADVICE);
        if (caregiverRisk > RECOMMENDATION_THRESHOLD) advice.add(CAREGIVER_ADVICE);
        if (stressRisk > RECOMMENDATION_THRESHOLD) advice.add(STRESS_ADVICE);
        if (advice.isEmpty()) advice.add(ALL_CLEAR);

        return new CareRisk(overall, riskLevelOf(overall), consistencyRisk, qualityRisk,
            frequencyRisk, caregiverRisk, stressRisk, advice);
    }

    public static RiskLevel riskLevelOf(double overallRisk) {
        if (overallRisk >= 0.8) return RiskLevel.CRITICAL;
        if (overallRisk >= 0.6) return RiskLevel.HIGH;
        if (overallRisk >= 0.4) return RiskLevel.MODERATE;
        return RiskLevel.LOW;
    }

    static double stressRisk(List<InteractionEvent> events) {
        if (events.isEmpty()) return NEUTRAL_STRESS_RISK;
        double averageDelta = events.stream().mapToInt(InteractionEvent::stressDelta).average().orElse(0.0);
        long spikes = events.stream()
            .filter(e -> e.stressDelta() >= PatternAnalyzer.STRESS_SPIKE_DELTA)
            .count();
        double averageRisk = clamp01((averageDelta + 3) / 6);
        double spikeRisk = Math.min(1.0, spikes / (events.size() * SPIKE_TOLERANCE));
        return (averageRisk + spikeRisk) / 2;
    }

    // ── Caregiver effectiveness ────────────────────────────────────

    /** Per-caregiver effectiveness, most effective first; ties keep caregiver id order. */
    public static List<CaregiverEffectiveness> caregiverEffectiveness(List<InteractionEvent> events) {
        Map<Long, List<InteractionEvent>> byCaregiver = new LinkedHashMap<>();
        for (InteractionEvent e : events) {
            byCaregiver.computeIfAbsent(e.caregiverId(), id -> new ArrayList<>()).add(e);
        }

        List<CaregiverEffectiveness> stats = new ArrayList<>();
        byCaregiver.forEach((caregiverId, own) -> {
            double bond = own.stream().mapToInt(InteractionEvent::bondDelta).average().orElse(0.0);
            double stress = own.stream().mapToInt(InteractionEvent::stressDelta).average().orElse(0.0);
            double quality = mean(qualityScores(own));

            double score = clamp01((bond + 3) / 6) * 0.4
                + clamp01((-stress + 3) / 6) * 0.3
                + normalisedQuality(quality) * 0.3;
            stats.add(new CaregiverEffectiveness(caregiverId, own.get(0).caregiverPersonality(),
                score, bond, stress, quality, own.size()));
        });

        stats.sort(Comparator.comparingDouble(CaregiverEffectiveness::effectivenessScore).reversed()
            .thenComparingLong(CaregiverEffectiveness::caregiverId));
        return stats;
    }

    // ── Helpers ────────────────────────────────────────────────────

    private static List<Double> qualityScores(List<InteractionEvent> events) {
        return events.stream()
            .map(e -> (double) (e.quality() == null ? QualityGrade.FAIR : e.quality()).score())
            .toList();
    }

    /** Maps a mean ordinal quality {@code 1..4} onto {@code 0..1}. */
    private static double normalisedQuality(double averageScore) {
        return (averageScore - QualityGrade.POOR.score())
            / (QualityGrade.EXCELLENT.score() - QualityGrade.POOR.score());
    }

    private static int distinctCaregivers(List<InteractionEvent> events) {
        Set<Long> ids = new HashSet<>();
        events.forEach(e -> ids.add(e.caregiverId()));
        return ids.size();
    }

    private static double mean(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    /** Population standard deviation. */
    private static double stdDev(List<Double> values) {
        double mean = mean(values);
        double variance = values.stream().mapToDouble(v -> (v - mean) * (v - mean)).average().orElse(0.0);
        return Math.sqrt(variance);
    }

    /** Standard deviation over mean, or 1 when the mean is not positive. */
    private static double coefficientOfVariation(List<Double> values) {
        double mean = mean(values);
        return mean > 0 ? stdDev(values) / mean : 1.0;
    }

    private static double clamp01(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
