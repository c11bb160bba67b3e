package com.z254.watchtower.vigil.domain.exception;

/**
 * Base exception for lifecycle and reporting failures.
 * <p>
 * Each subclass carries a stable error code that clients can switch on.
 */
public class IncidentManagementException extends RuntimeException {

    private final String errorCode;
    private final Object[] args;

    public IncidentManagementException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
        this.args = new Object[0];
    }

    public IncidentManagementException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.args = new Object[0];
    }

    public IncidentManagementException(String errorCode, String message, Object... args) {
        super(message);
        this.errorCode = errorCode;
        this.args = args;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public Object[] getArgs() {
        return args;
    }
}
