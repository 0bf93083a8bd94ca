package uk.gegc.ergtracker.features.society.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@Schema(description = "New society")
public record CreateSocietyRequest(
        @NotBlank(message = "Society name is required")
        @Size(max = 120, message = "Society name must be at most 120 characters")
        @Schema(example = "Canottieri Lario")
        String name
) {
}
