package uk.gegc.ergtracker.testsupport;

import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import uk.gegc.ergtracker.features.account.api.dto.AccountDto;
import uk.gegc.ergtracker.features.account.domain.model.Account;
import uk.gegc.ergtracker.features.account.domain.model.AccountRole;
import uk.gegc.ergtracker.features.account.domain.model.ApprovalStatus;
import uk.gegc.ergtracker.features.auth.infra.security.AccountPrincipal;
import uk.gegc.ergtracker.shared.security.CallerIdentity;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Builders for accounts, callers and authentications shared by unit and slice tests.
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static Account account(AccountRole role, UUID... societyIds) {
        Account account = new Account();
        account.setId(UUID.randomUUID());
        account.setEmail(role.getWireValue() + "-" + account.getId() + "@example.com");
        account.setName(role.getWireValue() + " " + account.getId().toString().substring(0, 8));
        account.setHashedPassword("hashed");
        account.setRole(role);
        account.setStatus(ApprovalStatus.APPROVED);
        account.setSocietyIds(List.of(societyIds));
        return account;
    }

    public static CallerIdentity callerOf(Account account) {
        return new CallerIdentity(account.getId(), account.getEmail(), account.getRole(), account.getSocietyIds());
    }

    public static Authentication authenticationOf(Account account) {
        AccountPrincipal principal = new AccountPrincipal(account.getId(), account.getEmail(), account.getRole(), 0L);
        return new UsernamePasswordAuthenticationToken(
                principal, null, List.of(new SimpleGrantedAuthority("ROLE_" + account.getRole().name())));
    }

    public static AccountDto accountDto(UUID id, String email, AccountRole role, ApprovalStatus status, UUID... societyIds) {
        List<UUID> societies = List.of(societyIds);
        return new AccountDto(id, email, "Test " + role.getWireValue(), role, status, societies,
                societies.isEmpty() ? null : societies.get(0), null, null, null, null, null,
                Instant.parse("2024-01-01T00:00:00Z"));
    }
}
