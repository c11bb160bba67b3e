package com.z254.watchtower.vigil.domain.exception;

/**
 * Thrown when an incident id does not resolve. Results in HTTP 404.
 */
public class IncidentNotFoundException extends IncidentManagementException {

    public static final String CODE = "INCIDENT_NOT_FOUND";

    public IncidentNotFoundException(String incidentId) {
        super(CODE, "Incident not found with ID: " + incidentId, incidentId);
    }
}
