package uk.gegc.ergtracker.features.auth.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.ergtracker.features.account.api.dto.AccountDto;

@Schema(name = "LoginResponse", description = "Access token and the authenticated account")
public record LoginResponse(
        String accessToken,
        @Schema(example = "Bearer")
        String tokenType,
        @Schema(description = "Token lifetime in milliseconds")
        long expiresInMs,
        AccountDto account
) {
    public static LoginResponse bearer(String accessToken, long expiresInMs, AccountDto account) {
        return new LoginResponse(accessToken, "Bearer", expiresInMs, account);
    }
}
