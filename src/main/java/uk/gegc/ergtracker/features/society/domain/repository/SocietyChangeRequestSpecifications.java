package uk.gegc.ergtracker.features.society.domain.repository;

import org.springframework.data.jpa.domain.Specification;
import uk.gegc.ergtracker.features.account.domain.model.ApprovalStatus;
import uk.gegc.ergtracker.features.society.domain.model.SocietyChangeRequest;

import java.util.Collection;
import java.util.UUID;

public final class SocietyChangeRequestSpecifications {

    private SocietyChangeRequestSpecifications() {
    }

    public static Specification<SocietyChangeRequest> withStatus(ApprovalStatus status) {
        return (root, query, cb) -> cb.equal(root.get("status"), status);
    }

    public static Specification<SocietyChangeRequest> targetsAnyOf(Collection<UUID> societyIds) {
        return (root, query, cb) -> societyIds == null || societyIds.isEmpty()
                ? cb.disjunction()
                : root.get("newSocietyId").in(societyIds);
    }

    public static Specification<SocietyChangeRequest> filedBy(UUID athleteId) {
        return (root, query, cb) -> cb.equal(root.get("athleteId"), athleteId);
    }
}
