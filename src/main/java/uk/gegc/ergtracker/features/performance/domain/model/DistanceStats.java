package uk.gegc.ergtracker.features.performance.domain.model;

/**
 * Best and latest result for one exact distance.
 *
 * @param label distance without trailing zeros followed by {@code m}, e.g. {@code 2000m}
 */
public record DistanceStats(
        String label,
        double distance,
        TestSnapshot best,
        TestSnapshot latest,
        int count
) {
}
