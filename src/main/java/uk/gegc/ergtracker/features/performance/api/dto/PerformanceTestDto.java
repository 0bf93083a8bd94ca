package uk.gegc.ergtracker.features.performance.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.UUID;

@Schema(description = "Recorded ergometer test with derived metrics")
public record PerformanceTestDto(
        UUID id,
        UUID subjectId,
        String subjectName,
        UUID societyId,
        String date,
        double distance,
        double timeSeconds,
        @Schema(description = "Seconds per 500 m")
        Double split500,
        Double watts,
        Double wattsPerKg,
        Integer strokes,
        Double weight,
        Double height,
        String notes,
        Instant createdAt
) {
}
