package uk.gegc.ergtracker.shared.security;

import uk.gegc.ergtracker.features.account.domain.model.AccountRole;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * The authenticated caller as seen by authorization rules. Memberships are read from the store per
 * request so a society transfer is visible immediately, unlike the claims carried by the token.
 */
public record CallerIdentity(
        UUID accountId,
        String email,
        AccountRole role,
        List<UUID> societyIds
) {
    public CallerIdentity {
        societyIds = societyIds == null ? List.of() : List.copyOf(societyIds);
    }

    public boolean isSuperAdmin() {
        return role == AccountRole.SUPER_ADMIN;
    }

    public boolean isAthlete() {
        return role == AccountRole.ATHLETE;
    }

    public boolean isSelf(UUID otherId) {
        return accountId != null && accountId.equals(otherId);
    }

    public boolean sharesSocietyWith(Collection<UUID> otherSocietyIds) {
        if (otherSocietyIds == null || otherSocietyIds.isEmpty()) {
            return false;
        }
        return societyIds.stream().anyMatch(otherSocietyIds::contains);
    }
}
