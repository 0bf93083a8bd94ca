package uk.gegc.ergtracker.shared.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.ergtracker.features.account.domain.model.Account;
import uk.gegc.ergtracker.features.account.domain.model.AccountRole;
import uk.gegc.ergtracker.features.account.domain.model.ApprovalStatus;
import uk.gegc.ergtracker.features.performance.domain.model.PerformanceTest;
import uk.gegc.ergtracker.features.society.domain.model.SocietyChangeRequest;
import uk.gegc.ergtracker.shared.exception.ForbiddenException;

import java.util.EnumSet;

import static uk.gegc.ergtracker.features.account.domain.repository.AccountSpecifications.hasRoleIn;
import static uk.gegc.ergtracker.features.account.domain.repository.AccountSpecifications.hasStatus;
import static uk.gegc.ergtracker.features.account.domain.repository.AccountSpecifications.memberOfAny;
import static uk.gegc.ergtracker.features.performance.domain.repository.PerformanceTestSpecifications.forSubject;
import static uk.gegc.ergtracker.features.performance.domain.repository.PerformanceTestSpecifications.visibleToCoach;
import static uk.gegc.ergtracker.features.society.domain.repository.SocietyChangeRequestSpecifications.filedBy;
import static uk.gegc.ergtracker.features.society.domain.repository.SocietyChangeRequestSpecifications.targetsAnyOf;
import static uk.gegc.ergtracker.features.society.domain.repository.SocietyChangeRequestSpecifications.withStatus;

/**
 * Role and membership rules for every read and mutation. Predicates ({@code canX}) answer,
 * enforcers ({@code requireX}) throw {@link ForbiddenException}, and listing methods return an
 * {@link AccessDecision} that scopes the repository query.
 */
@Component
@Slf4j
public class AccessControlEngine {

    private static final EnumSet<AccountRole> COACH_REVIEWABLE_ROLES = EnumSet.of(AccountRole.ATHLETE, AccountRole.COACH);

    // ---------- single-resource reads ----------

    /**
     * Self, super admins, coaches sharing a society, and the coach the account designated.
     */
    public boolean canViewAccount(CallerIdentity caller, Account target) {
        if (caller == null || target == null) {
            return false;
        }
        if (caller.isSelf(target.getId())) {
            return true;
        }
        return switch (caller.role()) {
            case SUPER_ADMIN -> true;
            case COACH -> caller.sharesSocietyWith(target.getSocietyIds())
                    || caller.isSelf(target.getDesignatedCoachId());
            case ATHLETE -> false;
        };
    }

    public void requireViewAccount(CallerIdentity caller, Account target) {
        if (!canViewAccount(caller, target)) {
            throwForbidden("Not allowed to view this account");
        }
    }

    public boolean canViewSubjectStats(CallerIdentity caller, Account subject) {
        return canViewAccount(caller, subject);
    }

    public void requireViewSubjectStats(CallerIdentity caller, Account subject) {
        if (!canViewSubjectStats(caller, subject)) {
            throwForbidden("Not allowed to view statistics of this account");
        }
    }

    // ---------- mutations ----------

    public boolean canCreateTestFor(CallerIdentity caller, Account subject) {
        if (caller == null || subject == null) {
            return false;
        }
        if (caller.isSelf(subject.getId())) {
            return true;
        }
        return switch (caller.role()) {
            case SUPER_ADMIN -> true;
            case COACH -> caller.sharesSocietyWith(subject.getSocietyIds());
            case ATHLETE -> false;
        };
    }

    public void requireCreateTestFor(CallerIdentity caller, Account subject) {
        if (!canCreateTestFor(caller, subject)) {
            throwForbidden("Not allowed to record tests for this account");
        }
    }

    public boolean canReviewAccount(CallerIdentity caller, Account target) {
        if (caller == null || target == null) {
            return false;
        }
        return switch (caller.role()) {
            case SUPER_ADMIN -> true;
            case COACH -> COACH_REVIEWABLE_ROLES.contains(target.getRole())
                    && caller.sharesSocietyWith(target.getSocietyIds());
            case ATHLETE -> false;
        };
    }

    public void requireReviewAccount(CallerIdentity caller, Account target) {
        if (!canReviewAccount(caller, target)) {
            throwForbidden("Not allowed to review this registration");
        }
    }

    public boolean canReviewSocietyChange(CallerIdentity caller, SocietyChangeRequest request) {
        if (caller == null || request == null) {
            return false;
        }
        return switch (caller.role()) {
            case SUPER_ADMIN -> true;
            case COACH -> caller.societyIds().contains(request.getNewSocietyId());
            case ATHLETE -> false;
        };
    }

    public void requireReviewSocietyChange(CallerIdentity caller, SocietyChangeRequest request) {
        if (!canReviewSocietyChange(caller, request)) {
            throwForbidden("Not allowed to review this society change");
        }
    }

    public void requireAthlete(CallerIdentity caller) {
        if (caller == null || !caller.isAthlete()) {
            throwForbidden("Only athletes can request a society change");
        }
    }

    /**
     * Society creation, designated-coach assignment and maintenance operations.
     */
    public void requireSuperAdmin(CallerIdentity caller) {
        if (caller == null || !caller.isSuperAdmin()) {
            throwForbidden("Super admin role required");
        }
    }

    // ---------- listings ----------

    public AccessDecision<Account> accountListing(CallerIdentity caller) {
        return switch (caller.role()) {
            case SUPER_ADMIN -> AccessDecision.permitAll();
            case COACH -> AccessDecision.permit(memberOfAny(caller.societyIds()));
            case ATHLETE -> AccessDecision.deny("Athletes cannot list accounts");
        };
    }

    public AccessDecision<Account> pendingListing(CallerIdentity caller) {
        return switch (caller.role()) {
            case SUPER_ADMIN -> AccessDecision.permit(hasStatus(ApprovalStatus.PENDING));
            case COACH -> AccessDecision.permit(hasStatus(ApprovalStatus.PENDING)
                    .and(hasRoleIn(COACH_REVIEWABLE_ROLES))
                    .and(memberOfAny(caller.societyIds())));
            case ATHLETE -> AccessDecision.deny("Athletes cannot list pending registrations");
        };
    }

    public AccessDecision<PerformanceTest> testListing(CallerIdentity caller) {
        return switch (caller.role()) {
            case SUPER_ADMIN -> AccessDecision.permitAll();
            case COACH -> AccessDecision.permit(visibleToCoach(caller.accountId(), caller.societyIds()));
            case ATHLETE -> AccessDecision.permit(forSubject(caller.accountId()));
        };
    }

    public AccessDecision<SocietyChangeRequest> societyChangeListing(CallerIdentity caller) {
        return switch (caller.role()) {
            case SUPER_ADMIN -> AccessDecision.permit(withStatus(ApprovalStatus.PENDING));
            case COACH -> AccessDecision.permit(withStatus(ApprovalStatus.PENDING).and(targetsAnyOf(caller.societyIds())));
            case ATHLETE -> AccessDecision.permit(filedBy(caller.accountId()));
        };
    }

    private void throwForbidden(String message) {
        log.debug("AccessControlEngine denying access: {}", message);
        throw new ForbiddenException(message);
    }
}
