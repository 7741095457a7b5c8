package com.skillpulse.processing.trend;

import com.skillpulse.processing.store.Snapshot;
import com.skillpulse.processing.store.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Classifies per-skill movement between the current counts and one stored snapshot.
 *
 * <p>A skill is rising when its count grew by at least {@link #RISING_THRESHOLD} of the
 * previous count, declining when it shrank by at least that much, and stable in between.
 * A skill absent from the comparison snapshot but present now counts as +100% and rising.
 */
public class TrendEngine {

    private static final Logger log = LoggerFactory.getLogger(TrendEngine.class);

    public static final double RISING_THRESHOLD = 0.15;
    public static final double DECLINING_THRESHOLD = -0.15;
    public static final double NEW_SKILL_PERCENTAGE = 100.0;

    private static final Comparator<TrendRecord> BY_MAGNITUDE =
        Comparator.comparingLong((TrendRecord r) -> Math.abs(r.absoluteChange())).reversed()
            .thenComparing(TrendRecord::skill);

    private final SnapshotStore store;

    public TrendEngine(SnapshotStore store) {
        this.store = store;
    }

    public SortedMap<String, TrendRecord> analyzeTrends(Map<String, Long> currentCounts) {
        return analyzeTrends(currentCounts, null, 1);
    }

    /**
     * @param currentCounts      skill to non-negative count for the period being analysed
     * @param comparisonPeriodId explicit period to compare against; when given but unknown the
     *                           comparison behaves as if no history existed
     * @param periodsBack        1 compares with the most recent stored period, 2 with the one
     *                           before, clamped to the oldest; values below 1 count as 1
     */
    public SortedMap<String, TrendRecord> analyzeTrends(Map<String, Long> currentCounts,
                                                        String comparisonPeriodId,
                                                        int periodsBack) {
        Map<String, Long> current = currentCounts == null ? Map.of() : currentCounts;
        Optional<Snapshot> comparison = resolveComparison(comparisonPeriodId, periodsBack);
        Map<String, Long> previous = comparison.map(Snapshot::counts).orElse(Map.of());

        if (comparison.isEmpty()) {
            log.debug("No comparison snapshot available; treating {} skills as new", current.size());
        } else {
            log.debug("Comparing {} skills against period {}", current.size(), comparison.get().period());
        }

        Set<String> skills = new HashSet<>(current.keySet());
        skills.addAll(previous.keySet());

        SortedMap<String, TrendRecord> out = new TreeMap<>();
        for (String skill : skills) {
            if (skill == null) continue;
            long now = countOf(current, skill);
            long before = countOf(previous, skill);
            compare(skill, now, before).ifPresent(r -> out.put(skill, r));
        }
        return out;
    }

    public TrendSummary getSummary(Map<String, TrendRecord> records) {
        List<TrendRecord> rising = new ArrayList<>();
        List<TrendRecord> stable = new ArrayList<>();
        List<TrendRecord> declining = new ArrayList<>();
        if (records != null) {
            for (TrendRecord r : records.values()) {
                switch (r.trend()) {
                    case RISING -> rising.add(r);
                    case STABLE -> stable.add(r);
                    case DECLINING -> declining.add(r);
                }
            }
        }
        rising.sort(BY_MAGNITUDE);
        stable.sort(BY_MAGNITUDE);
        declining.sort(BY_MAGNITUDE);
        return new TrendSummary(List.copyOf(rising), List.copyOf(stable), List.copyOf(declining));
    }

    static Optional<TrendRecord> compare(String skill, long current, long previous) {
        long absolute = current - previous;
        if (previous == 0) {
            if (current <= 0) return Optional.empty();
            return Optional.of(new TrendRecord(skill, current, 0, absolute, NEW_SKILL_PERCENTAGE, TrendClassification.RISING));
        }
        double fraction = (double) (current - previous) / previous;
        return Optional.of(new TrendRecord(skill, current, previous, absolute, percentage(fraction), classify(fraction)));
    }

    static TrendClassification classify(double fraction) {
        if (fraction >= RISING_THRESHOLD) return TrendClassification.RISING;
        if (fraction <= DECLINING_THRESHOLD) return TrendClassification.DECLINING;
        return TrendClassification.STABLE;
    }

    private static double percentage(double fraction) {
        return BigDecimal.valueOf(fraction * 100).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    private Optional<Snapshot> resolveComparison(String comparisonPeriodId, int periodsBack) {
        if (comparisonPeriodId != null && !comparisonPeriodId.isBlank()) {
            return store.load(comparisonPeriodId.strip());
        }
        List<String> periods = store.listPeriods().stream()
            .sorted(Comparator.reverseOrder())
            .toList();
        if (periods.isEmpty()) return Optional.empty();
        int index = Math.min(Math.max(periodsBack, 1) - 1, periods.size() - 1);
        return store.load(periods.get(index));
    }

    private static long countOf(Map<String, Long> counts, String skill) {
        Long c = counts.get(skill);
        return c == null ? 0L : c;
    }
}
