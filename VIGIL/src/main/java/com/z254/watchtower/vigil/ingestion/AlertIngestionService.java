package com.z254.watchtower.vigil.ingestion;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.watchtower.vigil.config.VigilProperties;
import com.z254.watchtower.vigil.domain.exception.RequestValidationException;
import com.z254.watchtower.vigil.domain.model.Incident;
import com.z254.watchtower.vigil.domain.model.IncidentDraft;
import com.z254.watchtower.vigil.domain.model.IncidentSource;
import com.z254.watchtower.vigil.domain.model.Severity;
import com.z254.watchtower.vigil.domain.repository.IncidentSourceRepository;
import com.z254.watchtower.vigil.domain.service.DirectoryLabels;
import com.z254.watchtower.vigil.domain.service.IncidentStateMachine;
import com.z254.watchtower.vigil.observability.VigilMetrics;
import com.z254.watchtower.vigil.observability.VigilStructuredLogger;
import com.z254.watchtower.vigil.observability.VigilStructuredLogger.IncidentEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.Optional;

/**
 * Turns alerts pushed by the monitoring system into incidents.
 * <p>
 * An alert carrying an id already seen for the configured integration only adds an
 * "Alert update" comment to the incident it opened. Anything else opens a new incident
 * through {@link IncidentStateMachine}, so it gets the usual timeline, subscriptions,
 * audit hash and notifications.
 */
@Slf4j
@Service
public class AlertIngestionService {

    static final String DEFAULT_TITLE = "Monitoring alert";
    static final int MAX_TITLE_LENGTH = 300;
    static final int MAX_DESCRIPTION_LENGTH = 10000;

    private final IncidentStateMachine stateMachine;
    private final IncidentSourceRepository sourceRepository;
    private final DirectoryLabels directory;
    private final VigilProperties properties;
    private final VigilMetrics metrics;
    private final VigilStructuredLogger structuredLogger;
    private final Clock clock;

    public AlertIngestionService(IncidentStateMachine stateMachine,
                                 IncidentSourceRepository sourceRepository,
                                 DirectoryLabels directory,
                                 VigilProperties properties,
                                 VigilMetrics metrics,
                                 VigilStructuredLogger structuredLogger,
                                 Clock clock) {
        this.stateMachine = stateMachine;
        this.sourceRepository = sourceRepository;
        this.directory = directory;
        this.properties = properties;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
    }

    @Transactional
    public AlertIngestionResult ingest(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            throw new RequestValidationException("Alert payload must be a JSON object");
        }
        VigilProperties.Ingestion config = properties.getIngestion();
        String integration = config.getIntegration();
        String actorId = config.getReporterId();

        String title = truncate(firstText(payload, "title").orElse(DEFAULT_TITLE), MAX_TITLE_LENGTH);
        Optional<String> externalId = firstText(payload, "alert_id", "event_id", "id");

        if (externalId.isPresent()) {
            Optional<IncidentSource> known = sourceRepository.findByIntegrationAndExternalId(integration, externalId.get());
            if (known.isPresent()) {
                String incidentId = known.get().getIncidentId();
                stateMachine.addComment(incidentId, "Alert update: " + title, actorId);
                metrics.recordAlertIngested(false);
                structuredLogger.logIncidentEvent(incidentId, actorId, IncidentEventType.ALERT_DEDUPLICATED,
                        "Repeated alert appended", Map.of("integration", integration, "externalId", externalId.get()));
                return new AlertIngestionResult(incidentId, false);
            }
        }

        Map<String, String> tags = AlertTags.parse(payload.get("tags"));
        Severity severity = AlertTags.severity(tags, title);
        String description = truncate(firstText(payload, "text", "message").orElse(title), MAX_DESCRIPTION_LENGTH);

        IncidentDraft draft = IncidentDraft.builder()
                .title(title)
                .description(description)
                .severity(severity)
                .primaryServiceId(serviceId(tags.get(AlertTags.SERVICE)))
                .build();
        Incident incident = stateMachine.createIncident(draft, actorId);

        externalId.ifPresent(id -> sourceRepository.saveAndFlush(IncidentSource.builder()
                .integration(integration)
                .externalId(id)
                .incidentId(incident.getId())
                .payload(storablePayload(payload))
                .createdAt(Instant.now(clock).truncatedTo(ChronoUnit.MILLIS))
                .build()));
        stateMachine.addComment(incident.getId(), "Alert received: " + title, actorId);

        metrics.recordAlertIngested(true);
        structuredLogger.logIncidentEvent(incident.getId(), actorId, IncidentEventType.ALERT_INGESTED,
                "Incident opened from alert", Map.of("integration", integration, "severity", severity.name(),
                        "externalId", externalId.orElse("")));
        return new AlertIngestionResult(incident.getId(), true);
    }

    /**
     * Unknown service keys are dropped rather than rejecting the alert.
     */
    private String serviceId(String serviceKey) {
        if (serviceKey == null || serviceKey.isBlank()) {
            return null;
        }
        Optional<String> serviceId = directory.findServiceIdByKey(serviceKey);
        if (serviceId.isEmpty()) {
            log.debug("Alert names unknown service '{}', leaving incident without a service", serviceKey);
        }
        return serviceId.orElse(null);
    }

    private static Optional<String> firstText(JsonNode payload, String... fields) {
        for (String field : fields) {
            JsonNode value = payload.get(field);
            if (value != null && value.isValueNode() && !value.isNull()) {
                String text = value.asText().trim();
                if (!text.isEmpty()) {
                    return Optional.of(text);
                }
            }
        }
        return Optional.empty();
    }

    private static String storablePayload(JsonNode payload) {
        String json = payload.toString();
        if (json.length() > IncidentSource.MAX_PAYLOAD_LENGTH) {
            log.warn("Alert payload of {} chars not stored", json.length());
            return null;
        }
        return json;
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }
}
