package uk.gegc.ergtracker.features.society.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.UUID;

@Schema(description = "Rowing society")
public record SocietyDto(
        UUID id,
        @Schema(example = "Canottieri Lario")
        String name,
        Instant createdAt
) {
}
