package uk.gegc.ergtracker.features.account.domain.repository;

import jakarta.persistence.criteria.Join;
import jakarta.persistence.criteria.Subquery;
import org.springframework.data.jpa.domain.Specification;
import uk.gegc.ergtracker.features.account.domain.model.Account;
import uk.gegc.ergtracker.features.account.domain.model.AccountRole;
import uk.gegc.ergtracker.features.account.domain.model.ApprovalStatus;

import java.util.Collection;
import java.util.UUID;

public final class AccountSpecifications {

    private AccountSpecifications() {
    }

    /**
     * Accounts holding at least one of the given memberships. An empty collection matches nothing.
     */
    public static Specification<Account> memberOfAny(Collection<UUID> societyIds) {
        return (root, query, cb) -> {
            if (societyIds == null || societyIds.isEmpty()) {
                return cb.disjunction();
            }
            Subquery<UUID> members = query.subquery(UUID.class);
            var member = members.from(Account.class);
            Join<Account, UUID> memberships = member.join("societyIds");
            members.select(member.get("id")).where(memberships.in(societyIds));
            return root.get("id").in(members);
        };
    }

    public static Specification<Account> hasStatus(ApprovalStatus status) {
        return (root, query, cb) -> cb.equal(root.get("status"), status);
    }

    public static Specification<Account> hasRoleIn(Collection<AccountRole> roles) {
        return (root, query, cb) -> root.get("role").in(roles);
    }
}
