package uk.gegc.ergtracker.features.performance.domain.repository;

import jakarta.persistence.criteria.Join;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.criteria.Subquery;
import org.springframework.data.jpa.domain.Specification;
import uk.gegc.ergtracker.features.account.domain.model.Account;
import uk.gegc.ergtracker.features.performance.domain.model.PerformanceTest;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

public final class PerformanceTestSpecifications {

    private PerformanceTestSpecifications() {
    }

    public static Specification<PerformanceTest> forSubject(UUID subjectId) {
        return (root, query, cb) -> cb.equal(root.get("subjectId"), subjectId);
    }

    /**
     * Tests a coach may read: own tests, tests of athletes who designated the coach, and tests of
     * anyone currently sharing a society with the coach. Membership is evaluated at query time.
     */
    public static Specification<PerformanceTest> visibleToCoach(UUID coachId, Collection<UUID> coachSocietyIds) {
        return (root, query, cb) -> {
            List<Predicate> anyOf = new ArrayList<>();
            anyOf.add(cb.equal(root.get("subjectId"), coachId));

            Subquery<UUID> designated = query.subquery(UUID.class);
            Root<Account> designator = designated.from(Account.class);
            designated.select(designator.get("id"))
                    .where(cb.equal(designator.get("designatedCoachId"), coachId));
            anyOf.add(root.get("subjectId").in(designated));

            if (coachSocietyIds != null && !coachSocietyIds.isEmpty()) {
                Subquery<UUID> members = query.subquery(UUID.class);
                Root<Account> member = members.from(Account.class);
                Join<Account, UUID> memberships = member.join("societyIds");
                members.select(member.get("id")).where(memberships.in(coachSocietyIds));
                anyOf.add(root.get("subjectId").in(members));
            }
            return cb.or(anyOf.toArray(Predicate[]::new));
        };
    }
}
