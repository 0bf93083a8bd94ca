package uk.gegc.ergtracker.features.account.domain.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

@Entity
@Table(name = "accounts")
@Getter
@Setter
@NoArgsConstructor
public class Account {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "account_id")
    private UUID id;

    @Column(name = "email", nullable = false, unique = true, length = 254)
    private String email;

    @Column(name = "password", nullable = false)
    private String hashedPassword;

    @Column(name = "password_changed_at")
    private Instant passwordChangedAt;

    @Column(name = "name", nullable = false, length = 120)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 20)
    private AccountRole role;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ApprovalStatus status;

    /**
     * Society memberships in insertion order. The first entry is the primary society.
     */
    @Setter(AccessLevel.NONE)
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "account_societies", joinColumns = @JoinColumn(name = "account_id"))
    @OrderColumn(name = "position")
    @Column(name = "society_id", nullable = false)
    private List<UUID> societyIds = new ArrayList<>();

    @Column(name = "birth_year")
    private Integer birthYear;

    @Column(name = "category", length = 40)
    private String category;

    @Column(name = "weight")
    private Double weight;

    @Column(name = "height")
    private Double height;

    @Column(name = "designated_coach_id")
    private UUID designatedCoachId;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * Replaces memberships, dropping nulls and repeated ids while keeping first-seen order.
     */
    public void setSocietyIds(List<UUID> ids) {
        List<UUID> deduplicated = ids == null
                ? List.of()
                : new ArrayList<>(new LinkedHashSet<>(ids.stream().filter(Objects::nonNull).toList()));
        this.societyIds.clear();
        this.societyIds.addAll(deduplicated);
    }

    public UUID getPrimarySocietyId() {
        return societyIds.isEmpty() ? null : societyIds.get(0);
    }
}
