package com.z254.watchtower.vigil.health;

import com.z254.watchtower.vigil.config.VigilProperties;
import com.z254.watchtower.vigil.domain.model.IncidentStatus;
import com.z254.watchtower.vigil.domain.repository.IncidentRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;

/**
 * Health indicator for VIGIL service.
 * <p>
 * Reports on:
 * <ul>
 *     <li>Incident store reachability and open incident count</li>
 *     <li>Enabled notification channels</li>
 *     <li>Whether audit hashing is active</li>
 * </ul>
 */
@Slf4j
@Component
public class VigilHealthIndicator implements ReactiveHealthIndicator {

    private final IncidentRepository incidentRepository;
    private final VigilProperties vigilProperties;

    public VigilHealthIndicator(IncidentRepository incidentRepository, VigilProperties vigilProperties) {
        this.incidentRepository = incidentRepository;
        this.vigilProperties = vigilProperties;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(this::checkHealth).subscribeOn(Schedulers.boundedElastic());
    }

    Health checkHealth() {
        Map<String, Object> details = new HashMap<>();
        boolean healthy = true;

        try {
            details.put("openIncidents",
                    incidentRepository.countByStatusNotIn(EnumSet.of(IncidentStatus.RESOLVED, IncidentStatus.CLOSED)));
        } catch (DataAccessException e) {
            healthy = false;
            details.put("store.error", "Incident store unavailable: " + e.getMessage());
            log.error("Health check failed for incident store", e);
        }

        long enabledChannels = vigilProperties.getNotifications().getChannels().stream()
                .filter(VigilProperties.Notifications.Channel::isEnabled)
                .count();
        details.put("notificationChannels", enabledChannels);
        details.put("auditHashing", vigilProperties.getAudit().isEnabled());

        return (healthy ? Health.up() : Health.down()).withDetails(details).build();
    }
}
