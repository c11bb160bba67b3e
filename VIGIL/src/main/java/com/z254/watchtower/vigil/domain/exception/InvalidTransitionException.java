package com.z254.watchtower.vigil.domain.exception;

import com.z254.watchtower.vigil.domain.model.IncidentStatus;
import lombok.Getter;

/**
 * Thrown when a requested status is not reachable from the current one. Results in HTTP 409.
 */
@Getter
public class InvalidTransitionException extends IncidentManagementException {

    public static final String CODE = "INVALID_STATUS_TRANSITION";

    private final IncidentStatus from;
    private final IncidentStatus to;

    public InvalidTransitionException(IncidentStatus from, IncidentStatus to) {
        super(CODE, String.format("Invalid transition: %s → %s", from, to), from, to);
        this.from = from;
        this.to = to;
    }
}
