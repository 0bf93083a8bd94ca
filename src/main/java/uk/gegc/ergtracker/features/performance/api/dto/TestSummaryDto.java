package uk.gegc.ergtracker.features.performance.api.dto;

public record TestSummaryDto(
        double timeSeconds,
        Double split500,
        Double watts,
        String date
) {
}
