package com.z254.watchtower.vigil.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Incident entity tracked through the lifecycle state machine.
 * <p>
 * Milestone timestamps are written once by the state machine and never rewritten,
 * so reopening an incident keeps its original {@code resolvedAt}.
 */
@Entity
@Table(name = "incidents", indexes = {
        @Index(name = "idx_incident_created_at", columnList = "created_at"),
        @Index(name = "idx_incident_status", columnList = "status"),
        @Index(name = "idx_incident_severity", columnList = "severity"),
        @Index(name = "idx_incident_team", columnList = "team_id"),
        @Index(name = "idx_incident_service", columnList = "primary_service_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Incident {

    /** Unique incident identifier */
    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @Column(name = "title", nullable = false, length = 300)
    private String title;

    @Column(name = "description", nullable = false, length = 10000)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private IncidentStatus status = IncidentStatus.NEW;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false, length = 10)
    @Builder.Default
    private Severity severity = Severity.DEFAULT;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "triaged_at")
    private Instant triagedAt;

    @Column(name = "in_progress_at")
    private Instant inProgressAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "closed_at")
    private Instant closedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "team_id", length = 36)
    private String teamId;

    @Column(name = "primary_service_id", length = 36)
    private String primaryServiceId;

    /** Immutable once the incident exists */
    @Column(name = "reporter_id", nullable = false, updatable = false, length = 36)
    private String reporterId;

    @Column(name = "assignee_id", length = 36)
    private String assigneeId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "incident_categories", joinColumns = @JoinColumn(name = "incident_id"))
    @Column(name = "category_id", length = 36)
    @Builder.Default
    private Set<String> categoryIds = new LinkedHashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "incident_tags", joinColumns = @JoinColumn(name = "incident_id"))
    @Column(name = "tag_id", length = 36)
    @Builder.Default
    private Set<String> tagIds = new LinkedHashSet<>();

    /** HMAC over the canonical incident payload, null when auditing is disabled */
    @Column(name = "audit_hash", length = 64)
    private String auditHash;

    @Column(name = "audit_hash_updated_at")
    private Instant auditHashUpdatedAt;

    /** Optimistic lock; null until first persisted */
    @Version
    @Column(name = "version")
    private Long version;

    /**
     * Record the milestone timestamp for {@code target}, keeping any value already present.
     */
    public void markMilestone(IncidentStatus target, Instant at) {
        switch (target) {
            case TRIAGED -> {
                if (triagedAt == null) triagedAt = at;
            }
            case IN_PROGRESS -> {
                if (inProgressAt == null) inProgressAt = at;
            }
            case RESOLVED -> {
                if (resolvedAt == null) resolvedAt = at;
            }
            case CLOSED -> {
                if (closedAt == null) closedAt = at;
            }
            default -> {
                // NEW, ON_HOLD and REOPENED carry no milestone
            }
        }
    }

    public boolean isReportedBy(String userId) {
        return reporterId != null && reporterId.equals(userId);
    }
}
