package uk.gegc.ergtracker.features.auth.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.UUID;

@Schema(name = "RegisterRequest", description = "Payload for account registration")
public record RegisterRequest(
        @Schema(description = "Login email", example = "rower@example.com")
        @NotBlank(message = "{email.blank}")
        @Email(message = "{email.invalid}")
        @Size(max = 254)
        String email,

        @Schema(description = "Password, at least 6 characters", example = "secret1")
        @NotBlank(message = "{password.blank}")
        @Size(min = 6, max = 128, message = "{password.length}")
        String password,

        @Schema(description = "Display name", example = "Giulia Rossi")
        @NotBlank(message = "Name is required")
        @Size(max = 120)
        String name,

        @Schema(description = "Requested role", allowableValues = {"super_admin", "coach", "athlete"}, example = "athlete")
        @NotBlank(message = "Role is required")
        String role,

        @Schema(description = "Society memberships; the first one becomes the primary society")
        List<UUID> societyIds,

        @Min(1900) @Max(2100)
        Integer birthYear,

        @Positive
        Double weight,

        @Positive
        Double height
) {
}
