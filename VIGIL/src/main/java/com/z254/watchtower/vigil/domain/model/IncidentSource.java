package com.z254.watchtower.vigil.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Links an incident to the external alert that opened it, so repeated deliveries of the
 * same alert land on the same incident.
 */
@Entity
@Table(name = "incident_sources", uniqueConstraints = {
        @UniqueConstraint(name = "uk_incident_source_integration_external", columnNames = {"integration", "external_id"})
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IncidentSource {

    public static final int MAX_PAYLOAD_LENGTH = 20000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "integration", nullable = false, updatable = false, length = 50)
    private String integration;

    @Column(name = "external_id", nullable = false, updatable = false, length = 200)
    private String externalId;

    @Column(name = "incident_id", nullable = false, updatable = false, length = 36)
    private String incidentId;

    /** Raw alert JSON as first received, null when it exceeds {@link #MAX_PAYLOAD_LENGTH} */
    @Column(name = "payload", length = MAX_PAYLOAD_LENGTH)
    private String payload;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
