package uk.gegc.ergtracker.features.performance.domain.model;

/**
 * Derived figures of a test. {@code wattsPerKg} is null when no usable weight is known.
 */
public record PerformanceMetrics(
        double split500,
        double watts,
        Double wattsPerKg
) {
}
