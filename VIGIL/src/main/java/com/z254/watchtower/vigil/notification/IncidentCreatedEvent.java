package com.z254.watchtower.vigil.notification;

import com.z254.watchtower.vigil.domain.model.Severity;

import java.time.Instant;

/**
 * Published by the state machine once a new incident has been written.
 */
public record IncidentCreatedEvent(
        String incidentId,
        String title,
        Severity severity,
        String reporterId,
        Instant createdAt
) {
}
