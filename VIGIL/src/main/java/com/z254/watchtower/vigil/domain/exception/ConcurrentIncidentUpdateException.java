package com.z254.watchtower.vigil.domain.exception;

/**
 * Thrown when another request changed the incident between read and write. Results in HTTP 409.
 */
public class ConcurrentIncidentUpdateException extends IncidentManagementException {

    public static final String CODE = "CONCURRENT_MODIFICATION";

    public ConcurrentIncidentUpdateException(String incidentId, Throwable cause) {
        super(CODE, "Incident " + incidentId + " was modified concurrently, retry with fresh state", cause);
    }
}
