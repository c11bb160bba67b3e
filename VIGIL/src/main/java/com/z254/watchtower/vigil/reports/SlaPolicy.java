package com.z254.watchtower.vigil.reports;

import com.z254.watchtower.vigil.config.VigilProperties;
import com.z254.watchtower.vigil.domain.model.Incident;
import com.z254.watchtower.vigil.domain.model.Severity;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;

/**
 * Time-to-resolve targets per severity.
 */
@Component
public class SlaPolicy {

    private static final Map<Severity, Duration> DEFAULTS = VigilProperties.Sla.defaultTargets();

    private final VigilProperties properties;

    public SlaPolicy(VigilProperties properties) {
        this.properties = properties;
    }

    public Duration targetFor(Severity severity) {
        Duration configured = properties.getSla().getTargets().get(severity);
        return configured != null ? configured : DEFAULTS.get(severity);
    }

    /**
     * Time from creation to first resolution, null while unresolved.
     */
    public static Duration timeToResolve(Incident incident) {
        if (incident.getResolvedAt() == null) {
            return null;
        }
        return Duration.between(incident.getCreatedAt(), incident.getResolvedAt());
    }

    /**
     * @return null for unresolved incidents
     */
    public Boolean isMet(Incident incident) {
        Duration ttr = timeToResolve(incident);
        if (ttr == null) {
            return null;
        }
        return ttr.compareTo(targetFor(incident.getSeverity())) <= 0;
    }
}
