package uk.gegc.ergtracker.features.auth.api.dto;

public record TokenSweepResponse(int deleted) {
}
