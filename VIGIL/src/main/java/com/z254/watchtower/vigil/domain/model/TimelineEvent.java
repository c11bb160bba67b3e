package com.z254.watchtower.vigil.domain.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Audit trail entry for an incident.
 * <p>
 * Entries are append-only: there are no setters and every column is non-updatable.
 * The identity id doubles as insertion order for events sharing a timestamp.
 */
@Entity
@Table(name = "incident_timeline_events", indexes = {
        @Index(name = "idx_timeline_incident_created", columnList = "incident_id, created_at")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class TimelineEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "incident_id", nullable = false, updatable = false, length = 36)
    private String incidentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, updatable = false, length = 20)
    private TimelineEventType type;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_status", updatable = false, length = 20)
    private IncidentStatus fromStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_status", updatable = false, length = 20)
    private IncidentStatus toStatus;

    @Column(name = "message", updatable = false, length = 10000)
    private String message;

    @Column(name = "author_id", nullable = false, updatable = false, length = 36)
    private String authorId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
