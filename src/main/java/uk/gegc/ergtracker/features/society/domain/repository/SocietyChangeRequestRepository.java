package uk.gegc.ergtracker.features.society.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.ergtracker.features.account.domain.model.ApprovalStatus;
import uk.gegc.ergtracker.features.society.domain.model.SocietyChangeRequest;

import java.time.Instant;
import java.util.UUID;

public interface SocietyChangeRequestRepository extends JpaRepository<SocietyChangeRequest, UUID>,
        JpaSpecificationExecutor<SocietyChangeRequest> {

    boolean existsByAthleteIdAndStatus(UUID athleteId, ApprovalStatus status);

    /**
     * Compare-and-set on the request status that also records the reviewer and releases the
     * athlete's pending slot.
     *
     * @return number of rows updated, 0 when the request was no longer in {@code expected}
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE SocietyChangeRequest r
            SET r.status = :target, r.reviewedAt = :reviewedAt, r.reviewedBy = :reviewedBy, r.pendingAthleteId = null
            WHERE r.id = :id AND r.status = :expected
            """)
    int transitionStatus(@Param("id") UUID id,
                         @Param("expected") ApprovalStatus expected,
                         @Param("target") ApprovalStatus target,
                         @Param("reviewedAt") Instant reviewedAt,
                         @Param("reviewedBy") UUID reviewedBy);
}
