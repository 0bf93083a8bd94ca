package uk.gegc.ergtracker.features.account.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.ergtracker.features.account.domain.model.Account;
import uk.gegc.ergtracker.features.account.domain.model.ApprovalStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface AccountRepository extends JpaRepository<Account, UUID>, JpaSpecificationExecutor<Account> {

    Optional<Account> findByEmailIgnoreCase(String email);

    boolean existsByEmailIgnoreCase(String email);

    List<Account> findAllByBirthYearIsNotNull();

    /**
     * Compare-and-set on the approval status.
     *
     * @return 1 when the row was still in {@code expected}, 0 otherwise
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Account a
            SET a.status = :target, a.updatedAt = :now
            WHERE a.id = :id AND a.status = :expected
            """)
    int transitionStatus(@Param("id") UUID id,
                         @Param("expected") ApprovalStatus expected,
                         @Param("target") ApprovalStatus target,
                         @Param("now") Instant now);
}
