package com.z254.watchtower.vigil.domain.exception;

/**
 * Thrown when the acting user may not perform an operation. Results in HTTP 403.
 */
public class ForbiddenOperationException extends IncidentManagementException {

    public static final String CODE = "FORBIDDEN_OPERATION";

    public ForbiddenOperationException(String message) {
        super(CODE, message);
    }
}
