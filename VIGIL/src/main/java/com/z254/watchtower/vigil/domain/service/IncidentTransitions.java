package com.z254.watchtower.vigil.domain.service;

import com.z254.watchtower.vigil.domain.model.IncidentStatus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.z254.watchtower.vigil.domain.model.IncidentStatus.*;

/**
 * Allowed status transitions.
 * <p>
 * Same-status transitions are never allowed. No state is terminal: CLOSED may be reopened.
 */
public final class IncidentTransitions {

    private static final Map<IncidentStatus, Set<IncidentStatus>> ALLOWED = new EnumMap<>(IncidentStatus.class);

    static {
        ALLOWED.put(NEW, EnumSet.of(TRIAGED, IN_PROGRESS));
        ALLOWED.put(TRIAGED, EnumSet.of(IN_PROGRESS, ON_HOLD, RESOLVED));
        ALLOWED.put(IN_PROGRESS, EnumSet.of(ON_HOLD, RESOLVED));
        ALLOWED.put(ON_HOLD, EnumSet.of(IN_PROGRESS, RESOLVED));
        ALLOWED.put(RESOLVED, EnumSet.of(CLOSED, REOPENED));
        ALLOWED.put(CLOSED, EnumSet.of(REOPENED));
        ALLOWED.put(REOPENED, EnumSet.of(IN_PROGRESS, ON_HOLD, RESOLVED));
    }

    private IncidentTransitions() {}

    public static Set<IncidentStatus> allowedNext(IncidentStatus current) {
        return Collections.unmodifiableSet(ALLOWED.getOrDefault(current, EnumSet.noneOf(IncidentStatus.class)));
    }

    public static boolean isAllowed(IncidentStatus from, IncidentStatus to) {
        return from != null && to != null && ALLOWED.getOrDefault(from, Set.of()).contains(to);
    }
}
