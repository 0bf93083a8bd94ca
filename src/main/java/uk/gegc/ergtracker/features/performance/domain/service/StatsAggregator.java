package uk.gegc.ergtracker.features.performance.domain.service;

import org.springframework.stereotype.Component;
import uk.gegc.ergtracker.features.performance.domain.model.DistanceStats;
import uk.gegc.ergtracker.features.performance.domain.model.PerformanceTest;
import uk.gegc.ergtracker.features.performance.domain.model.TestSnapshot;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Groups a subject's history by exact distance and picks the best and the latest result of each group.
 * Equal times or dates are broken by the earliest creation time, then by the lowest id.
 */
@Component
public class StatsAggregator {

    private static final Comparator<PerformanceTest> OLDEST_FIRST =
            Comparator.comparing(PerformanceTest::getCreatedAt, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
                    .thenComparing(PerformanceTest::getId, Comparator.nullsLast(Comparator.<UUID>naturalOrder()));

    private static final Comparator<PerformanceTest> BEST =
            Comparator.comparingDouble(PerformanceTest::getTimeSeconds).thenComparing(OLDEST_FIRST);

    private static final Comparator<PerformanceTest> LATEST =
            Comparator.comparing(PerformanceTest::getDate, Comparator.nullsLast(Comparator.<String>reverseOrder()))
                    .thenComparing(OLDEST_FIRST);

    /**
     * @return one entry per distance, in ascending distance order; empty for an empty history
     */
    public List<DistanceStats> aggregate(List<PerformanceTest> history) {
        Map<Double, List<PerformanceTest>> byDistance = history.stream()
                .collect(Collectors.groupingBy(PerformanceTest::getDistance, TreeMap::new, Collectors.toList()));

        return byDistance.entrySet().stream()
                .map(entry -> summarize(entry.getKey(), entry.getValue()))
                .toList();
    }

    public static String label(double distance) {
        return BigDecimal.valueOf(distance).stripTrailingZeros().toPlainString() + "m";
    }

    private DistanceStats summarize(double distance, List<PerformanceTest> group) {
        PerformanceTest best = group.stream().min(BEST).orElseThrow();
        PerformanceTest latest = group.stream().min(LATEST).orElseThrow();
        return new DistanceStats(label(distance), distance, TestSnapshot.of(best), TestSnapshot.of(latest), group.size());
    }
}
