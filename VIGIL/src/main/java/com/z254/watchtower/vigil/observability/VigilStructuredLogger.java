package com.z254.watchtower.vigil.observability;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured logging utility for VIGIL service.
 * <p>
 * Emits one machine-readable line per lifecycle event ({@code message | data={json}})
 * with the incident and actor ids pushed to MDC for the duration of the call.
 */
@Slf4j
@Component
public class VigilStructuredLogger {

    // MDC keys
    public static final String MDC_INCIDENT_ID = "incidentId";
    public static final String MDC_ACTOR_ID = "actorId";

    /**
     * Log an incident lifecycle event.
     */
    public void logIncidentEvent(String incidentId, String actorId, IncidentEventType eventType, String message) {
        logIncidentEvent(incidentId, actorId, eventType, message, null);
    }

    /**
     * Log an incident lifecycle event with details.
     */
    public void logIncidentEvent(String incidentId, String actorId, IncidentEventType eventType,
                                 String message, Map<String, Object> details) {
        Map<String, String> context = new LinkedHashMap<>();
        context.put(MDC_INCIDENT_ID, incidentId);
        if (actorId != null) {
            context.put(MDC_ACTOR_ID, actorId);
        }
        try (var scope = withContext(context)) {
            Map<String, Object> logData = new LinkedHashMap<>();
            logData.put("event", eventType.name());
            logData.put("incidentId", incidentId);
            if (actorId != null) {
                logData.put("actorId", actorId);
            }
            if (details != null) {
                logData.putAll(details);
            }

            switch (eventType) {
                case TRANSITION_REJECTED, CONFLICT, DELETE_REFUSED ->
                        log.warn("{} | data={}", message, formatLogData(logData));
                case NOTIFICATION_FAILED, AUDIT_MISMATCH ->
                        log.error("{} | data={}", message, formatLogData(logData));
                default -> log.info("{} | data={}", message, formatLogData(logData));
            }
        }
    }

    /**
     * Set MDC context.
     */
    public MDCScope withContext(Map<String, String> context) {
        context.forEach(MDC::put);
        return new MDCScope(context.keySet().toArray(new String[0]));
    }

    private String formatLogData(Map<String, Object> data) {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            if (!first) sb.append(", ");
            first = false;

            sb.append("\"").append(entry.getKey()).append("\": ");
            Object value = entry.getValue();
            if (value == null) {
                sb.append("null");
            } else if (value instanceof Number || value instanceof Boolean) {
                sb.append(value);
            } else {
                sb.append("\"").append(escapeJson(value.toString())).append("\"");
            }
        }
        sb.append("}");
        return sb.toString();
    }

    private String escapeJson(String value) {
        return value.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
    }

    public enum IncidentEventType {
        CREATED, STATUS_CHANGED, TRANSITION_REJECTED, FIELDS_UPDATED, COMMENTED,
        DELETED, DELETE_REFUSED, CONFLICT, NOTIFICATION_SENT, NOTIFICATION_FAILED, NOTIFICATION_SKIPPED,
        AUDIT_MISMATCH, ALERT_INGESTED, ALERT_DEDUPLICATED
    }

    /**
     * Auto-closeable MDC scope for cleanup.
     */
    public static class MDCScope implements AutoCloseable {
        private final String[] keys;

        public MDCScope(String... keys) {
            this.keys = keys;
        }

        @Override
        public void close() {
            for (String key : keys) {
                MDC.remove(key);
            }
        }
    }
}
