package uk.gegc.ergtracker.features.society.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.ergtracker.features.account.domain.model.ApprovalStatus;

import java.time.Instant;
import java.util.UUID;

@Schema(description = "Society change request")
public record SocietyChangeRequestDto(
        UUID id,
        UUID athleteId,
        String athleteName,
        @Schema(description = "Primary society when the request was filed", nullable = true)
        UUID oldSocietyId,
        UUID newSocietyId,
        String newSocietyName,
        ApprovalStatus status,
        Instant createdAt,
        Instant reviewedAt,
        UUID reviewedBy
) {
}
