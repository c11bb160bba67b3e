package com.z254.watchtower.vigil.notification;

import com.z254.watchtower.vigil.config.VigilProperties;
import com.z254.watchtower.vigil.domain.model.Severity;
import com.z254.watchtower.vigil.observability.VigilMetrics;
import com.z254.watchtower.vigil.observability.VigilStructuredLogger;
import com.z254.watchtower.vigil.observability.VigilStructuredLogger.IncidentEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Alerts configured channels when a high-severity incident is opened.
 * <p>
 * Runs after the creating transaction commits. The reporter is the recipient: a channel kind
 * the reporter switched off is skipped. Delivery is fire-and-continue, so a failing channel is
 * logged and counted and never affects the incident or the other channels.
 */
@Slf4j
@Component
public class NotificationTrigger {

    private final NotificationGateway gateway;
    private final IntegrationSettingsService integrationSettings;
    private final VigilProperties properties;
    private final VigilMetrics metrics;
    private final VigilStructuredLogger structuredLogger;

    public NotificationTrigger(NotificationGateway gateway,
                               IntegrationSettingsService integrationSettings,
                               VigilProperties properties,
                               VigilMetrics metrics,
                               VigilStructuredLogger structuredLogger) {
        this.gateway = gateway;
        this.integrationSettings = integrationSettings;
        this.properties = properties;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
    }

    public static boolean shouldNotify(Severity severity) {
        return severity != null && severity.isHighSeverity();
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onIncidentCreated(IncidentCreatedEvent event) {
        if (!shouldNotify(event.severity())) {
            log.debug("Incident {} is {}, no notification", event.incidentId(), event.severity());
            return;
        }
        dispatch(NotificationMessage.builder()
                .incidentId(event.incidentId())
                .title(event.title())
                .severity(event.severity())
                .link(deepLink(event.incidentId()))
                .recipientId(event.reporterId())
                .build());
    }

    /**
     * Send {@code message} to every enabled channel the recipient has not switched off.
     *
     * @return number of channels a send was attempted on
     */
    public int dispatch(NotificationMessage message) {
        List<NotificationDestination> destinations = properties.getNotifications().getChannels().stream()
                .filter(VigilProperties.Notifications.Channel::isEnabled)
                .map(NotificationDestination::from)
                .filter(destination -> wantedBy(message, destination))
                .toList();
        if (destinations.isEmpty()) {
            log.debug("No notification channel enabled, incident {} not announced", message.getIncidentId());
            return 0;
        }
        for (NotificationDestination destination : destinations) {
            sendQuietly(message, destination);
        }
        return destinations.size();
    }

    String deepLink(String incidentId) {
        String base = properties.getNotifications().getPublicBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/incidents/" + incidentId;
    }

    private boolean wantedBy(NotificationMessage message, NotificationDestination destination) {
        String recipientId = message.getRecipientId();
        if (recipientId == null) {
            return true;
        }
        boolean enabled;
        try {
            enabled = integrationSettings.isEnabled(recipientId, destination.getKind());
        } catch (RuntimeException e) {
            // an unreadable preference must not silence a high-severity alert
            log.warn("Could not read integration settings of {}, notifying anyway: {}", recipientId, e.getMessage());
            return true;
        }
        if (!enabled) {
            structuredLogger.logIncidentEvent(message.getIncidentId(), recipientId, IncidentEventType.NOTIFICATION_SKIPPED,
                    "Channel switched off by recipient", Map.of("channel", destination.getName()));
        }
        return enabled;
    }

    private void sendQuietly(NotificationMessage message, NotificationDestination destination) {
        Mono<Void> delivery;
        try {
            delivery = gateway.send(message, destination);
        } catch (RuntimeException e) {
            onFailure(message, destination, e);
            return;
        }
        delivery.subscribe(
                ignored -> { },
                error -> onFailure(message, destination, error),
                () -> onSuccess(message, destination));
    }

    private void onSuccess(NotificationMessage message, NotificationDestination destination) {
        metrics.recordNotificationSent(destination.getKind());
        structuredLogger.logIncidentEvent(message.getIncidentId(), null, IncidentEventType.NOTIFICATION_SENT,
                "Notification delivered", Map.of("channel", destination.getName()));
    }

    private void onFailure(NotificationMessage message, NotificationDestination destination, Throwable error) {
        metrics.recordNotificationFailed(destination.getKind());
        structuredLogger.logIncidentEvent(message.getIncidentId(), null, IncidentEventType.NOTIFICATION_FAILED,
                "Notification delivery failed",
                Map.of("channel", destination.getName(), "error", String.valueOf(error.getMessage())));
    }
}
