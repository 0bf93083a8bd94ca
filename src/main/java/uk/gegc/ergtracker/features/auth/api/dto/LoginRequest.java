package uk.gegc.ergtracker.features.auth.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Schema(name = "LoginRequest", description = "Email and password credentials")
public record LoginRequest(
        @Schema(example = "rower@example.com")
        @NotBlank(message = "{email.blank}")
        String email,

        @NotBlank(message = "{password.blank}")
        String password
) {
}
