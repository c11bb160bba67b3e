package com.z254.watchtower.vigil.observability;

import com.z254.watchtower.vigil.domain.model.IncidentStatus;
import com.z254.watchtower.vigil.domain.model.Severity;
import com.z254.watchtower.vigil.notification.ChannelKind;
import io.micrometer.core.instrument.*;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Centralized metrics for VIGIL service.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Incident lifecycle (created, transitions, rejected transitions, deletions)</li>
 *     <li>Collaboration (comments)</li>
 *     <li>Notification dispatch (sent, failed per channel kind)</li>
 *     <li>Alert ingestion (opened, deduplicated)</li>
 *     <li>Report generation latency</li>
 * </ul>
 */
@Component
public class VigilMetrics {

    private final MeterRegistry meterRegistry;

    // Incident metrics
    private final Map<Severity, Counter> incidentsCreated = new ConcurrentHashMap<>();
    private final Map<IncidentStatus, Counter> transitions = new ConcurrentHashMap<>();
    @Getter
    private final Counter transitionsRejected;
    @Getter
    private final Counter incidentsDeleted;
    @Getter
    private final Counter commentsAdded;
    @Getter
    private final Counter concurrentUpdateConflicts;

    // Notification metrics
    private final Map<String, Counter> notificationsSent = new ConcurrentHashMap<>();
    private final Map<String, Counter> notificationsFailed = new ConcurrentHashMap<>();

    // Ingestion metrics
    private final Map<String, Counter> alertsIngested = new ConcurrentHashMap<>();

    // Report metrics
    private final Map<String, Timer> reportTimers = new ConcurrentHashMap<>();

    public VigilMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.transitionsRejected = Counter.builder("vigil.incidents.transitions.rejected")
                .description("Status changes rejected by the transition table")
                .register(meterRegistry);
        this.incidentsDeleted = Counter.builder("vigil.incidents.deleted")
                .description("Incidents hard-deleted by their reporter")
                .register(meterRegistry);
        this.commentsAdded = Counter.builder("vigil.incidents.comments")
                .description("Comments added to incidents")
                .register(meterRegistry);
        this.concurrentUpdateConflicts = Counter.builder("vigil.incidents.conflicts")
                .description("Writes rejected by optimistic locking")
                .register(meterRegistry);
    }

    public void recordIncidentCreated(Severity severity) {
        incidentsCreated.computeIfAbsent(severity, s ->
                Counter.builder("vigil.incidents.created")
                        .description("Total incidents created")
                        .tag("severity", s.name())
                        .register(meterRegistry))
                .increment();
    }

    public void recordTransition(IncidentStatus to) {
        transitions.computeIfAbsent(to, s ->
                Counter.builder("vigil.incidents.transitions")
                        .description("Applied status transitions by target status")
                        .tag("to", s.name())
                        .register(meterRegistry))
                .increment();
    }

    public void recordNotificationSent(ChannelKind kind) {
        notificationsSent.computeIfAbsent(kind.name(), k ->
                Counter.builder("vigil.notifications.sent")
                        .description("Notifications accepted by a destination")
                        .tag("kind", k)
                        .register(meterRegistry))
                .increment();
    }

    public void recordNotificationFailed(ChannelKind kind) {
        notificationsFailed.computeIfAbsent(kind.name(), k ->
                Counter.builder("vigil.notifications.failed")
                        .description("Notifications that could not be delivered")
                        .tag("kind", k)
                        .register(meterRegistry))
                .increment();
    }

    public void recordAlertIngested(boolean created) {
        alertsIngested.computeIfAbsent(created ? "created" : "deduplicated", outcome ->
                Counter.builder("vigil.alerts.ingested")
                        .description("Monitoring alerts received by outcome")
                        .tag("outcome", outcome)
                        .register(meterRegistry))
                .increment();
    }

    /**
     * Time a report computation, tagged by report type.
     */
    public <T> T timeReport(String report, Supplier<T> computation) {
        Timer timer = reportTimers.computeIfAbsent(report, r ->
                Timer.builder("vigil.reports.duration")
                        .description("Report generation duration")
                        .tag("report", r)
                        .publishPercentiles(0.5, 0.95, 0.99)
                        .register(meterRegistry));
        return timer.record(computation);
    }
}
