package uk.gegc.ergtracker.features.performance.domain.service;

import org.springframework.stereotype.Component;
import uk.gegc.ergtracker.features.performance.domain.model.PerformanceMetrics;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Concept2-style ergometer figures: split per 500 m, power from pace, and power per kilogram.
 */
@Component
public class MetricsEngine {

    private static final double POWER_CONSTANT = 2.8;
    private static final double SPLIT_DISTANCE = 500.0;

    public PerformanceMetrics compute(double distance, double timeSeconds, Double weight) {
        double split = split500(distance, timeSeconds);
        double watts = watts(split);
        return new PerformanceMetrics(split, watts, wattsPerKg(watts, weight));
    }

    /** Seconds per 500 m, unrounded. Zero for a non-positive distance or a result out of double range. */
    public double split500(double distance, double timeSeconds) {
        if (distance <= 0) {
            return 0;
        }
        double split = timeSeconds / distance * SPLIT_DISTANCE;
        return Double.isFinite(split) ? split : 0;
    }

    /** Zero for a non-positive split, or one so small that the cube underflows. */
    public double watts(double split500) {
        if (split500 <= 0 || !Double.isFinite(split500)) {
            return 0;
        }
        double pace = split500 / SPLIT_DISTANCE;
        double watts = POWER_CONSTANT / (pace * pace * pace);
        return Double.isFinite(watts) ? round2(watts) : 0;
    }

    /** Null when the weight is unknown or not positive. */
    public Double wattsPerKg(double watts, Double weight) {
        if (weight == null || weight <= 0) {
            return null;
        }
        double perKg = watts / weight;
        return Double.isFinite(perKg) ? round2(perKg) : null;
    }

    /**
     * Picks the value supplied with the request when present, otherwise the stored one.
     */
    public static Double effective(Double explicit, Double stored) {
        return explicit != null ? explicit : stored;
    }

    static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
