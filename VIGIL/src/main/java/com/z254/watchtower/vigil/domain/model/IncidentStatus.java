package com.z254.watchtower.vigil.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of an incident.
 */
public enum IncidentStatus {

    /**
     * Incident has been reported and nobody has looked at it yet.
     */
    NEW,

    /**
     * Incident has been assessed and prioritised.
     */
    TRIAGED,

    /**
     * Someone is actively working on the incident.
     */
    IN_PROGRESS,

    /**
     * Work is paused, waiting on an external party.
     */
    ON_HOLD,

    /**
     * Impact has been mitigated.
     */
    RESOLVED,

    /**
     * Incident has been reviewed and closed.
     */
    CLOSED,

    /**
     * A resolved or closed incident has resurfaced.
     */
    REOPENED;

    private static final Set<IncidentStatus> NOT_OPEN = EnumSet.of(RESOLVED, CLOSED);
    private static final Set<IncidentStatus> COUNTED_AS_RESOLVED = EnumSet.of(RESOLVED, REOPENED, CLOSED);

    /**
     * Open means anything that is neither resolved nor closed.
     */
    public boolean isOpen() {
        return !NOT_OPEN.contains(this);
    }

    /**
     * Statuses whose incidents count towards the resolved KPI when they carry a resolution time.
     */
    public boolean countsAsResolved() {
        return COUNTED_AS_RESOLVED.contains(this);
    }
}
