package uk.gegc.ergtracker.features.performance.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Best and latest result for one distance")
public record DistanceStatsDto(
        @Schema(description = "Fastest time")
        TestSummaryDto best,
        @Schema(description = "Most recent date")
        TestSummaryDto latest,
        int count
) {
}
