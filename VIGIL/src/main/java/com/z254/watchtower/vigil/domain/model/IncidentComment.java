package com.z254.watchtower.vigil.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Free-text comment left on an incident.
 */
@Entity
@Table(name = "incident_comments", indexes = {
        @Index(name = "idx_comment_incident_created", columnList = "incident_id, created_at")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IncidentComment {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @Column(name = "incident_id", nullable = false, updatable = false, length = 36)
    private String incidentId;

    @Column(name = "author_id", nullable = false, updatable = false, length = 36)
    private String authorId;

    @Column(name = "body", nullable = false, length = 10000)
    private String body;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
