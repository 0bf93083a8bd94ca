package uk.gegc.ergtracker.features.society.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import uk.gegc.ergtracker.features.account.domain.model.ApprovalStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * An athlete's request to move to another society. Names are snapshots taken when the request is filed.
 */
@Entity
@Table(name = "society_change_requests")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class SocietyChangeRequest {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "request_id")
    private UUID id;

    @Column(name = "athlete_id", nullable = false)
    private UUID athleteId;

    @Column(name = "athlete_name", nullable = false, length = 120)
    private String athleteName;

    @Column(name = "old_society_id")
    private UUID oldSocietyId;

    @Column(name = "new_society_id", nullable = false)
    private UUID newSocietyId;

    @Column(name = "new_society_name", nullable = false, length = 120)
    private String newSocietyName;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ApprovalStatus status;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "reviewed_at")
    private Instant reviewedAt;

    @Column(name = "reviewed_by")
    private UUID reviewedBy;

    /**
     * Holds the athlete id while the request is pending and null once it is decided.
     * The unique constraint allows a single pending request per athlete.
     */
    @Column(name = "pending_athlete_id", unique = true)
    private UUID pendingAthleteId;

    @PrePersist
    void applyDefaults() {
        if (status == null) {
            status = ApprovalStatus.PENDING;
        }
        pendingAthleteId = status == ApprovalStatus.PENDING ? athleteId : null;
    }
}
