package uk.gegc.ergtracker.features.auth.infra.security;

import uk.gegc.ergtracker.features.account.domain.model.AccountRole;

import java.security.Principal;
import java.util.UUID;

/**
 * Identity carried by a verified access token.
 *
 * @param passwordChangedAt epoch millis of the last password change when the token was issued
 */
public record AccountPrincipal(
        UUID accountId,
        String email,
        AccountRole role,
        long passwordChangedAt
) implements Principal {

    @Override
    public String getName() {
        return accountId.toString();
    }
}
