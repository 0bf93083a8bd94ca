package uk.gegc.ergtracker.shared.security;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Component;
import uk.gegc.ergtracker.features.account.domain.model.Account;
import uk.gegc.ergtracker.features.account.domain.repository.AccountRepository;
import uk.gegc.ergtracker.features.auth.infra.security.AccountPrincipal;
import uk.gegc.ergtracker.features.auth.infra.security.JwtTokenService;
import uk.gegc.ergtracker.shared.exception.UnauthorizedException;

/**
 * Turns the request's {@link Authentication} into a {@link CallerIdentity}, loading current
 * memberships from the store.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CallerResolver {

    private final AccountRepository accountRepository;

    public CallerIdentity resolve(Authentication authentication) {
        Account account = loadAccount(authentication);
        AccountPrincipal principal = (AccountPrincipal) authentication.getPrincipal();
        return new CallerIdentity(account.getId(), principal.email(), principal.role(), account.getSocietyIds());
    }

    /**
     * @throws UnauthorizedException when there is no token principal, the account is gone,
     *                               or its password changed after the token was issued
     */
    public Account loadAccount(Authentication authentication) {
        if (authentication == null || !(authentication.getPrincipal() instanceof AccountPrincipal principal)) {
            throw new UnauthorizedException("Authentication required");
        }
        Account account = accountRepository.findById(principal.accountId())
                .orElseThrow(() -> new UnauthorizedException("Account no longer exists"));
        if (JwtTokenService.toEpochMillis(account.getPasswordChangedAt()) > principal.passwordChangedAt()) {
            log.debug("Rejecting token for account {} issued before the last password change", account.getId());
            throw new UnauthorizedException("Token is no longer valid");
        }
        return account;
    }
}
