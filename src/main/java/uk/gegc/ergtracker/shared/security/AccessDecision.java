package uk.gegc.ergtracker.shared.security;

import org.springframework.data.jpa.domain.Specification;
import uk.gegc.ergtracker.shared.exception.ForbiddenException;

import java.util.Objects;

/**
 * Outcome of scoping a listing query: everything, a filtered subset, or nothing at all.
 *
 * @param <T> entity type the filter applies to
 */
public final class AccessDecision<T> {

    private final Specification<T> filter;
    private final String denialReason;

    private AccessDecision(Specification<T> filter, String denialReason) {
        this.filter = filter;
        this.denialReason = denialReason;
    }

    public static <T> AccessDecision<T> permitAll() {
        return new AccessDecision<>((root, query, cb) -> cb.conjunction(), null);
    }

    public static <T> AccessDecision<T> permit(Specification<T> filter) {
        return new AccessDecision<>(Objects.requireNonNull(filter, "filter"), null);
    }

    public static <T> AccessDecision<T> deny(String reason) {
        return new AccessDecision<>(null, reason != null ? reason : "Access denied");
    }

    public boolean isDenied() {
        return denialReason != null;
    }

    /**
     * @return the filter to apply to the listing query
     * @throws ForbiddenException when the decision is a denial
     */
    public Specification<T> filterOrThrow() {
        if (isDenied()) {
            throw new ForbiddenException(denialReason);
        }
        return filter;
    }
}
