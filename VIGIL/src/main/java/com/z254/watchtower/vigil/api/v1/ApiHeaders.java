package com.z254.watchtower.vigil.api.v1;

/**
 * Request headers understood by the v1 API.
 */
public final class ApiHeaders {

    /** Id of the acting user, set by the authenticating gateway */
    public static final String USER_ID = "X-User-Id";

    /** Shared secret presented by the monitoring system on alert webhooks */
    public static final String WEBHOOK_TOKEN = "X-Webhook-Token";

    private ApiHeaders() {}
}
