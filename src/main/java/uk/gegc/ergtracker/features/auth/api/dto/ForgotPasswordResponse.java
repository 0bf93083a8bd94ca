package uk.gegc.ergtracker.features.auth.api.dto;

public record ForgotPasswordResponse(String message) {
}
