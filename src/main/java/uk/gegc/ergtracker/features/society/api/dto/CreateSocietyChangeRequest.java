package uk.gegc.ergtracker.features.society.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

import java.util.UUID;

@Schema(description = "Athlete request to move to another society")
public record CreateSocietyChangeRequest(
        @NotNull(message = "Target society is required")
        UUID newSocietyId
) {
}
