package uk.gegc.ergtracker.features.auth.api.dto;

public record ResetPasswordResponse(String message) {
}
