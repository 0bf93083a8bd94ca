package uk.gegc.ergtracker.features.account.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.ergtracker.features.account.domain.model.AccountRole;
import uk.gegc.ergtracker.features.account.domain.model.ApprovalStatus;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Schema(description = "Account profile as visible to authorized callers")
public record AccountDto(
        @Schema(description = "Account identifier", example = "3f0c2a1e-8f0a-4a57-9c7e-2b7d6f1a9c11")
        UUID id,

        @Schema(description = "Login email")
        String email,

        @Schema(description = "Display name")
        String name,

        @Schema(description = "Role", example = "athlete")
        AccountRole role,

        @Schema(description = "Registration approval status")
        ApprovalStatus status,

        @Schema(description = "Society memberships; the first one is the primary society")
        List<UUID> societyIds,

        @Schema(description = "Primary society, null when the account has no membership")
        UUID primarySocietyId,

        Integer birthYear,

        @Schema(description = "Age category for the current year", example = "JUNIOR")
        String category,

        @Schema(description = "Body weight in kg")
        Double weight,

        @Schema(description = "Height in cm")
        Double height,

        @Schema(description = "Coach granted read access to this account's results")
        UUID designatedCoachId,

        Instant createdAt
) {
}
