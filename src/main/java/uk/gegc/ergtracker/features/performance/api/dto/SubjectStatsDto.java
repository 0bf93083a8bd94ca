package uk.gegc.ergtracker.features.performance.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@Schema(description = "Per-distance statistics of one subject")
public record SubjectStatsDto(
        UUID subjectId,
        int testsCount,
        @Schema(description = "Keyed by distance label such as 2000m, ascending distance")
        Map<String, DistanceStatsDto> stats,
        @Schema(description = "Full history, newest date first")
        List<PerformanceTestDto> allTests
) {
}
