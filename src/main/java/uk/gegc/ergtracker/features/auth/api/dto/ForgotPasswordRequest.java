package uk.gegc.ergtracker.features.auth.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

@Schema(name = "ForgotPasswordRequest")
public record ForgotPasswordRequest(
        @Schema(example = "rower@example.com")
        @NotBlank(message = "{email.blank}")
        @Email(message = "{email.invalid}")
        String email
) {
}
