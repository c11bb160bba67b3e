package com.z254.watchtower.vigil.domain.exception;

/**
 * Thrown for malformed input: unknown enum values, bad ranges, dangling references.
 * Results in HTTP 400.
 */
public class RequestValidationException extends IncidentManagementException {

    public static final String CODE = "VALIDATION_ERROR";

    public RequestValidationException(String message) {
        super(CODE, message);
    }

    public RequestValidationException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
