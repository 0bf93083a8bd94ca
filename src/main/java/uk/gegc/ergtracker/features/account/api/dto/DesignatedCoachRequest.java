package uk.gegc.ergtracker.features.account.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.UUID;

@Schema(description = "Designated coach assignment; a null coachId clears it")
public record DesignatedCoachRequest(
        @Schema(description = "Coach account to designate", nullable = true)
        UUID coachId
) {
}
