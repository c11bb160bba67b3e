package com.z254.watchtower.vigil.domain.exception;

/**
 * Thrown when stored incident data no longer matches its audit hash. Results in HTTP 409.
 */
public class AuditIntegrityException extends IncidentManagementException {

    public static final String CODE = "AUDIT_INTEGRITY_VIOLATION";

    public AuditIntegrityException(String incidentId) {
        super(CODE, "Audit hash mismatch for incident " + incidentId, incidentId);
    }
}
