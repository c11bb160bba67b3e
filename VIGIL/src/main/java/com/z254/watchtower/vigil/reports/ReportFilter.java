package com.z254.watchtower.vigil.reports;

import com.z254.watchtower.vigil.domain.exception.RequestValidationException;
import com.z254.watchtower.vigil.domain.model.Incident;
import com.z254.watchtower.vigil.domain.model.Severity;
import com.z254.watchtower.vigil.domain.repository.IncidentSpecifications;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.jpa.domain.Specification;

import java.time.*;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Incident population a report is computed over.
 * <p>
 * The time range applies to {@code createdAt} and is half-open: {@code from} inclusive,
 * {@code to} exclusive. Every criterion is optional.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportFilter {

    public static final int MAX_LAST_DAYS = 365;

    private Instant from;
    private Instant to;
    private String teamId;
    private String serviceId;
    private Severity severity;

    public static ReportFilter all() {
        return new ReportFilter();
    }

    /**
     * Build a filter from raw request parameters.
     * <p>
     * Instants may be full ISO-8601 timestamps or plain dates (midnight UTC). {@code lastDays}
     * only applies when {@code from} is absent.
     */
    public static ReportFilter parse(String from, String to, Integer lastDays, String teamId,
                                     String serviceId, String severity, Clock clock) {
        Instant fromInstant = parseInstant(from, "from");
        Instant toInstant = parseInstant(to, "to");
        if (fromInstant == null && lastDays != null) {
            if (lastDays < 1 || lastDays > MAX_LAST_DAYS) {
                throw new RequestValidationException("lastDays must be between 1 and " + MAX_LAST_DAYS);
            }
            Instant end = toInstant != null ? toInstant : Instant.now(clock);
            fromInstant = end.minus(Duration.ofDays(lastDays));
        }
        ReportFilter filter = ReportFilter.builder()
                .from(fromInstant)
                .to(toInstant)
                .teamId(blankToNull(teamId))
                .serviceId(blankToNull(serviceId))
                .severity(parseSeverity(severity))
                .build();
        filter.validate();
        return filter;
    }

    public void validate() {
        if (from != null && to != null && !from.isBefore(to)) {
            throw new RequestValidationException("from must be before to");
        }
    }

    public Specification<Incident> toSpecification() {
        return Specification.where(IncidentSpecifications.createdWithin(from, to))
                .and(IncidentSpecifications.hasTeam(teamId))
                .and(IncidentSpecifications.hasPrimaryService(serviceId))
                .and(IncidentSpecifications.hasSeverity(severity));
    }

    private static Instant parseInstant(String value, String name) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        try {
            if (trimmed.length() == 10) {
                return LocalDate.parse(trimmed).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            return OffsetDateTime.parse(trimmed).toInstant();
        } catch (DateTimeParseException e) {
            throw new RequestValidationException("Invalid " + name + " timestamp: " + value, e);
        }
    }

    private static Severity parseSeverity(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new RequestValidationException("Unknown severity: " + value, e);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
