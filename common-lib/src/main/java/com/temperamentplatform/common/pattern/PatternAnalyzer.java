package com.temperamentplatform.common.pattern;

import com.temperamentplatform.common.model.InteractionEvent;
import com.temperamentplatform.common.model.QualityGrade;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Pure stateless interpreter that turns a subject's interaction history into
 * {@link PatternMetrics}.
 *
 * <p>Only events inside the {@link AnalysisWindow} are considered. The window already
 * excludes everything at or after the maturity cutoff, so callers may pass an unfiltered
 * history. Input order does not matter: events are sorted by timestamp before any
 * order-dependent metric (trends, reassignments, critical periods) is computed.
 *
 * <h3>Day accounting</h3>
 * <p>Each event maps to the day index {@code floor((t - windowStart) / 1 day)}. A day
 * "has care" when at least one event maps to it. Care gaps and extended neglect periods
 * are maximal runs of care-free days; the window start and end act as anchors, so a
 * quiet stretch at either edge of the window counts.
 *
 * <p>No Spring dependencies. No I/O. Pure function.
 */
public final class PatternAnalyzer {

    /** Minimum care-free run counted as a care gap. */
    public static final int CARE_GAP_DAYS = 3;

    /** Minimum care-free run counted as an extended neglect period. */
    public static final int EXTENDED_NEGLECT_DAYS = 5;

    private static final double GAP_PENALTY_PER_GAP = 0.1;
    private static final double MAX_GAP_PENALTY = 0.5;

    public static final int STRESS_SPIKE_DELTA = 3;

    private static final double DIVERSITY_TASK_RATIO = 0.3;

    private static final double CAREGIVER_COUNT_PENALTY = 0.2;
    private static final double REASSIGNMENT_PENALTY = 0.1;

    private static final double NEGLECT_THRESHOLD = 0.5;
    private static final double SEVERE_NEGLECT_THRESHOLD = 0.7;

    private static final int CRITICAL_STRESS_FIRST = 3;
    private static final int CRITICAL_STRESS_SECOND = 2;
    private static final int CRITICAL_BOND_FIRST = -2;
    private static final int CRITICAL_BOND_SECOND = -1;

    private PatternAnalyzer() { /* utility class */ }

    /**
     * Analyzes {@code events} over {@code window}.
     *
     * @param events interaction history; may be unordered and may extend beyond the window
     * @param window analysis bounds
     * @return metrics; never null, zero-valued for an empty window
     */
    public static PatternMetrics analyze(List<InteractionEvent> events, AnalysisWindow window) {
        List<InteractionEvent> inWindow = inWindowChronological(events, window);

        return new PatternMetrics(
            window,
            inWindow.size(),
            careConsistency(inWindow, window),
            bondPattern(inWindow),
            stressPattern(inWindow),
            qualityTrend(inWindow),
            taskDiversity(inWindow),
            caregiverStability(inWindow),
            neglectPattern(inWindow, window),
            criticalPeriods(inWindow),
            CareScoring.consistencyBreakdown(inWindow),
            CareScoring.careRisk(inWindow, window),
            CareScoring.caregiverEffectiveness(inWindow)
        );
    }

    /** Events inside {@code window}, sorted by timestamp (stable for ties). */
    public static List<InteractionEvent> inWindowChronological(List<InteractionEvent> events,
                                                               AnalysisWindow window) {
        if (events == null || events.isEmpty()) return List.of();
        return events.stream()
            .filter(Objects::nonNull)
            .filter(e -> e.occurredAt() != null && window.contains(e.occurredAt()))
            .sorted(Comparator.comparing(InteractionEvent::occurredAt))
            .toList();
    }

    // ── Consistency ────────────────────────────────────────────────

    public static CareConsistency careConsistency(List<InteractionEvent> events, AnalysisWindow window) {
        int totalDays = window.totalDays();
        if (events.isEmpty()) {
            return new CareConsistency(0.0, 0.0, 0, totalDays, List.of(), 0.0);
        }

        Set<Integer> careDays = careDays(events, window);
        double careFrequency = (double) careDays.size() / totalDays;
        List<CareGap> gaps = careFreeRuns(careDays, totalDays, CARE_GAP_DAYS);
        double gapPenalty = Math.min(gaps.size() * GAP_PENALTY_PER_GAP, MAX_GAP_PENALTY);
        double score = clamp01(careFrequency * (1.0 - gapPenalty));

        return new CareConsistency(score, careFrequency, careDays.size(), totalDays, gaps,
            (double) events.size() / totalDays);
    }

    // ── Bond / stress / quality ────────────────────────────────────

    public static BondPattern bondPattern(List<InteractionEvent> events) {
        List<Double> deltas = events.stream().map(e -> (double) e.bondDelta()).toList();
        Trend trend = TrendCalculator.improvementTrend(deltas);
        if (events.isEmpty()) {
            return new BondPattern(trend, 0.0, 0, 0.0);
        }

        int total = events.stream().mapToInt(InteractionEvent::bondDelta).sum();
        long positive = events.stream().filter(e -> e.bondDelta() > 0).count();
        return new BondPattern(trend, (double) total / events.size(), total,
            (double) positive / events.size());
    }

    public static StressPattern stressPattern(List<InteractionEvent> events) {
        List<Double> deltas = events.stream().map(e -> (double) e.stressDelta()).toList();
        Trend trend = TrendCalculator.levelTrend(deltas);
        if (events.isEmpty()) {
            return new StressPattern(trend, 0.0, 0.0, 0, List.of());
        }

        int total = 0;
        int reductionSum = 0;
        int reductionCount = 0;
        List<StressSpike> spikes = new ArrayList<>();
        for (InteractionEvent e : events) {
            total += e.stressDelta();
            if (e.stressDelta() < 0) {
                reductionSum += e.stressDelta();
                reductionCount++;
            }
            if (e.stressDelta() >= STRESS_SPIKE_DELTA) {
                spikes.add(new StressSpike(e.occurredAt(), e.stressDelta(), e.taskCategory()));
            }
        }

        double averageReduction = reductionCount == 0 ? 0.0 : (double) reductionSum / reductionCount;
        return new StressPattern(trend, averageReduction, (double) total / events.size(), total, spikes);
    }

    public static Trend qualityTrend(List<InteractionEvent> events) {
        List<Double> scores = events.stream()
            .map(e -> (double) gradeOf(e).score())
            .toList();
        return TrendCalculator.improvementTrend(scores);
    }

    // ── Diversity / caregivers ─────────────────────────────────────

    public static TaskDiversity taskDiversity(List<InteractionEvent> events) {
        if (events.isEmpty()) {
            return new TaskDiversity(0.0, 0, 0.0, Map.of());
        }

        Set<String> tasks = new HashSet<>();
        Map<QualityGrade, Integer> distribution = new EnumMap<>(QualityGrade.class);
        for (InteractionEvent e : events) {
            if (e.taskCategory() != null) tasks.add(e.taskCategory());
            distribution.merge(gradeOf(e), 1, Integer::sum);
        }

        int n = events.size();
        double score = Math.min(1.0, tasks.size() / Math.max(n * DIVERSITY_TASK_RATIO, 1.0));
        double excellentRatio = (double) distribution.getOrDefault(QualityGrade.EXCELLENT, 0) / n;
        return new TaskDiversity(score, tasks.size(), excellentRatio, distribution);
    }

    public static CaregiverStability caregiverStability(List<InteractionEvent> events) {
        if (events.isEmpty()) {
            return new CaregiverStability(0.0, 0, 0);
        }

        Set<Long> caregivers = new HashSet<>();
        int reassignments = 0;
        Long previous = null;
        for (InteractionEvent e : events) {
            caregivers.add(e.caregiverId());
            if (previous != null && previous != e.caregiverId()) {
                reassignments++;
            }
            previous = e.caregiverId();
        }

        double score = 1.0 / (1.0
            + CAREGIVER_COUNT_PENALTY * (caregivers.size() - 1)
            + REASSIGNMENT_PENALTY * reassignments);
        return new CaregiverStability(score, caregivers.size(), reassignments);
    }

    // ── Neglect ────────────────────────────────────────────────────

    public static NeglectPattern neglectPattern(List<InteractionEvent> events, AnalysisWindow window) {
        int totalDays = window.totalDays();
        Set<Integer> careDays = careDays(events, window);
        int daysWithoutCare = totalDays - careDays.size();
        double ratio = events.isEmpty() ? 1.0 : (double) daysWithoutCare / totalDays;

        List<CareGap> extended = careFreeRuns(careDays, totalDays, EXTENDED_NEGLECT_DAYS);
        int longest = careFreeRuns(careDays, totalDays, 1).stream()
            .mapToInt(CareGap::lengthDays)
            .max()
            .orElse(0);

        return new NeglectPattern(ratio, ratio > NEGLECT_THRESHOLD, severityOf(ratio),
            daysWithoutCare, extended, longest);
    }

    public static NeglectSeverity severityOf(double neglectRatio) {
        if (neglectRatio > SEVERE_NEGLECT_THRESHOLD) return NeglectSeverity.SEVERE;
        if (neglectRatio > NEGLECT_THRESHOLD) return NeglectSeverity.MODERATE;
        return NeglectSeverity.MINIMAL;
    }

    // ── Critical periods ───────────────────────────────────────────

    public static List<CriticalPeriod> criticalPeriods(List<InteractionEvent> events) {
        List<CriticalPeriod> periods = new ArrayList<>();
        for (int i = 1; i < events.size(); i++) {
            InteractionEvent first = events.get(i - 1);
            InteractionEvent second = events.get(i);

            if (first.stressDelta() >= CRITICAL_STRESS_FIRST && second.stressDelta() >= CRITICAL_STRESS_SECOND) {
                periods.add(new CriticalPeriod(CriticalPeriodType.STRESS_SPIKE,
                    first.occurredAt(), second.occurredAt()));
            }
            if (first.bondDelta() <= CRITICAL_BOND_FIRST && second.bondDelta() <= CRITICAL_BOND_SECOND) {
                periods.add(new CriticalPeriod(CriticalPeriodType.BONDING_FAILURE,
                    first.occurredAt(), second.occurredAt()));
            }
        }
        return periods;
    }

    // ── Helpers ────────────────────────────────────────────────────

    private static Set<Integer> careDays(List<InteractionEvent> events, AnalysisWindow window) {
        Set<Integer> days = new TreeSet<>();
        for (InteractionEvent e : events) {
            int day = window.dayIndex(e.occurredAt());
            if (day >= 0 && day < window.totalDays()) days.add(day);
        }
        return days;
    }

    /**
     * Maximal runs of care-free days of at least {@code minLength} days, in day order.
     * {@code careDays} must iterate in ascending order.
     */
    static List<CareGap> careFreeRuns(Set<Integer> careDays, int totalDays, int minLength) {
        List<CareGap> runs = new ArrayList<>();
        int anchor = -1;
        for (int day : careDays) {
            addRun(runs, anchor + 1, day - 1, minLength);
            anchor = day;
        }
        addRun(runs, anchor + 1, totalDays - 1, minLength);
        return runs;
    }

    private static void addRun(List<CareGap> runs, int startDay, int endDay, int minLength) {
        if (endDay - startDay + 1 >= minLength) {
            runs.add(new CareGap(startDay, endDay));
        }
    }

    private static QualityGrade gradeOf(InteractionEvent e) {
        return e.quality() == null ? QualityGrade.FAIR : e.quality();
    }

    private static double clamp01(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
