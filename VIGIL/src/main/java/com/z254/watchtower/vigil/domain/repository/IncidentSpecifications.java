package com.z254.watchtower.vigil.domain.repository;

import com.z254.watchtower.vigil.domain.model.Incident;
import com.z254.watchtower.vigil.domain.model.IncidentQuery;
import com.z254.watchtower.vigil.domain.model.IncidentStatus;
import com.z254.watchtower.vigil.domain.model.Severity;
import org.springframework.data.jpa.domain.Specification;

import java.time.Instant;
import java.util.Locale;

/**
 * Composable incident predicates. A {@code null} argument yields a match-all predicate.
 */
public final class IncidentSpecifications {

    private static final char LIKE_ESCAPE = '\\';

    private IncidentSpecifications() {}

    /**
     * Creation time within the half-open range {@code [from, to)}.
     */
    public static Specification<Incident> createdWithin(Instant from, Instant to) {
        return (root, query, cb) -> {
            if (from == null && to == null) {
                return null;
            }
            if (from == null) {
                return cb.lessThan(root.get("createdAt"), to);
            }
            if (to == null) {
                return cb.greaterThanOrEqualTo(root.get("createdAt"), from);
            }
            return cb.and(
                    cb.greaterThanOrEqualTo(root.get("createdAt"), from),
                    cb.lessThan(root.get("createdAt"), to));
        };
    }

    public static Specification<Incident> hasTeam(String teamId) {
        return (root, query, cb) -> teamId == null ? null : cb.equal(root.get("teamId"), teamId);
    }

    public static Specification<Incident> hasPrimaryService(String serviceId) {
        return (root, query, cb) -> serviceId == null ? null : cb.equal(root.get("primaryServiceId"), serviceId);
    }

    public static Specification<Incident> hasSeverity(Severity severity) {
        return (root, query, cb) -> severity == null ? null : cb.equal(root.get("severity"), severity);
    }

    public static Specification<Incident> hasStatus(IncidentStatus status) {
        return (root, query, cb) -> status == null ? null : cb.equal(root.get("status"), status);
    }

    public static Specification<Incident> hasAssignee(String assigneeId) {
        return (root, query, cb) -> assigneeId == null ? null : cb.equal(root.get("assigneeId"), assigneeId);
    }

    /**
     * Case-insensitive substring match on title or description. LIKE wildcards in
     * {@code search} match literally.
     */
    public static Specification<Incident> matchesText(String search) {
        return (root, query, cb) -> {
            if (search == null || search.isBlank()) {
                return null;
            }
            String pattern = "%" + escapeLike(search.trim().toLowerCase(Locale.ROOT)) + "%";
            return cb.or(
                    cb.like(cb.lower(root.get("title")), pattern, LIKE_ESCAPE),
                    cb.like(cb.lower(root.get("description")), pattern, LIKE_ESCAPE));
        };
    }

    static String escapeLike(String value) {
        StringBuilder escaped = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            if (c == LIKE_ESCAPE || c == '%' || c == '_') {
                escaped.append(LIKE_ESCAPE);
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    /**
     * Predicate for the list view. The service key must already be resolved to an id.
     */
    public static Specification<Incident> forQuery(IncidentQuery q, String resolvedServiceId) {
        return Specification.where(hasStatus(q.getStatus()))
                .and(hasSeverity(q.getSeverity()))
                .and(hasAssignee(q.getAssigneeId()))
                .and(hasTeam(q.getTeamId()))
                .and(hasPrimaryService(resolvedServiceId))
                .and(matchesText(q.getSearch()))
                .and(createdWithin(q.getCreatedFrom(), q.getCreatedTo()));
    }
}
