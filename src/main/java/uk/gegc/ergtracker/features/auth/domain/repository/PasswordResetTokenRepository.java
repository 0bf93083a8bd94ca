package uk.gegc.ergtracker.features.auth.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.ergtracker.features.auth.domain.model.PasswordResetToken;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

public interface PasswordResetTokenRepository extends JpaRepository<PasswordResetToken, UUID> {

    @Query("SELECT p FROM PasswordResetToken p WHERE p.tokenHash = :tokenHash AND p.used = false AND p.expiresAt > :now")
    Optional<PasswordResetToken> findByTokenHashAndUsedFalseAndExpiresAtAfter(
            @Param("tokenHash") String tokenHash, @Param("now") LocalDateTime now);

    @Modifying
    @Query("DELETE FROM PasswordResetToken p WHERE p.expiresAt < :now")
    int deleteExpiredTokens(@Param("now") LocalDateTime now);

    @Modifying
    @Query("UPDATE PasswordResetToken p SET p.used = true WHERE p.accountId = :accountId AND p.used = false")
    int invalidateAccountTokens(@Param("accountId") UUID accountId);

    /**
     * Consumes the token only if it is still unused and unexpired.
     *
     * @return 1 when this call consumed the token, 0 when another call got there first or it expired
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PasswordResetToken p SET p.used = true WHERE p.id = :id AND p.used = false AND p.expiresAt > :now")
    int markUsedIfValid(@Param("id") UUID id, @Param("now") LocalDateTime now);
}
