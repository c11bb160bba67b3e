package com.z254.watchtower.vigil.domain.exception;

/**
 * Thrown when an inbound webhook does not carry the configured token. Results in HTTP 401.
 */
public class WebhookAuthenticationException extends IncidentManagementException {

    public static final String CODE = "WEBHOOK_UNAUTHORIZED";

    public WebhookAuthenticationException(String message) {
        super(CODE, message);
    }
}
