package uk.gegc.ergtracker.features.performance.domain.model;

import java.util.UUID;

public record TestSnapshot(
        UUID testId,
        double timeSeconds,
        Double split500,
        Double watts,
        String date
) {
    public static TestSnapshot of(PerformanceTest test) {
        return new TestSnapshot(test.getId(), test.getTimeSeconds(), test.getSplit500(), test.getWatts(), test.getDate());
    }
}
