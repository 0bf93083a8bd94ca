package uk.gegc.ergtracker.features.performance.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.util.UUID;

@Schema(description = "Raw test result; split and power figures are computed by the server")
public record CreatePerformanceTestRequest(
        @NotNull(message = "Subject is required")
        @Schema(description = "Account the result belongs to")
        UUID subjectId,

        @NotNull(message = "Date is required")
        @Pattern(regexp = "\\d{4}-\\d{2}-\\d{2}", message = "Date must be formatted as yyyy-MM-dd")
        @Schema(example = "2024-03-15")
        String date,

        @NotNull(message = "Distance is required")
        @Positive(message = "Distance must be positive")
        @DecimalMax(value = "100000", message = "Distance must be at most 100000 metres")
        @Schema(description = "Metres", example = "2000")
        Double distance,

        @NotNull(message = "Time is required")
        @Positive(message = "Time must be positive")
        @DecimalMax(value = "86400", message = "Time must be at most 86400 seconds")
        @Schema(description = "Seconds", example = "420.5")
        Double timeSeconds,

        @PositiveOrZero
        Integer strokes,

        @Positive(message = "Weight must be positive")
        @Schema(description = "Weight in kg; falls back to the subject's stored weight when absent")
        Double weight,

        @Positive(message = "Height must be positive")
        @Schema(description = "Height in cm; falls back to the subject's stored height when absent")
        Double height,

        @Size(max = 2000, message = "Notes must be at most 2000 characters")
        String notes
) {
}
