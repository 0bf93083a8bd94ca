package uk.gegc.ergtracker.features.auth.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@Schema(name = "ResetPasswordRequest")
public record ResetPasswordRequest(
        @Schema(description = "Token from the reset email")
        @NotBlank(message = "Reset token is required")
        String token,

        @NotBlank(message = "{password.blank}")
        @Size(min = 6, max = 128, message = "{password.length}")
        String newPassword
) {
}
