package com.z254.watchtower.vigil.reports.export;

import com.z254.watchtower.vigil.audit.AuditHashService;
import com.z254.watchtower.vigil.config.VigilProperties;
import com.z254.watchtower.vigil.domain.exception.RequestValidationException;
import com.z254.watchtower.vigil.domain.model.Incident;
import com.z254.watchtower.vigil.domain.model.IncidentComment;
import com.z254.watchtower.vigil.domain.model.TimelineEvent;
import com.z254.watchtower.vigil.domain.model.TimelineEventType;
import com.z254.watchtower.vigil.domain.service.DirectoryLabels;
import com.z254.watchtower.vigil.domain.service.IncidentQueryService;
import com.z254.watchtower.vigil.observability.VigilMetrics;
import com.z254.watchtower.vigil.reports.KpiSnapshot;
import com.z254.watchtower.vigil.reports.MetricsAggregator;
import com.z254.watchtower.vigil.reports.ReportFilter;
import com.z254.watchtower.vigil.reports.ReportScope;
import com.z254.watchtower.vigil.reports.SlaPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Tabular, CSV and document exports.
 */
@Slf4j
@Service
public class ReportExporter {

    private final ReportScope scope;
    private final MetricsAggregator metricsAggregator;
    private final IncidentQueryService incidentQueryService;
    private final DirectoryLabels directory;
    private final SlaPolicy slaPolicy;
    private final AuditHashService auditHashService;
    private final DocumentRenderer documentRenderer;
    private final VigilProperties properties;
    private final VigilMetrics metrics;
    private final Clock clock;

    public ReportExporter(ReportScope scope,
                          MetricsAggregator metricsAggregator,
                          IncidentQueryService incidentQueryService,
                          DirectoryLabels directory,
                          SlaPolicy slaPolicy,
                          AuditHashService auditHashService,
                          DocumentRenderer documentRenderer,
                          VigilProperties properties,
                          VigilMetrics metrics,
                          Clock clock) {
        this.scope = scope;
        this.metricsAggregator = metricsAggregator;
        this.incidentQueryService = incidentQueryService;
        this.directory = directory;
        this.slaPolicy = slaPolicy;
        this.auditHashService = auditHashService;
        this.documentRenderer = documentRenderer;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * One row per matching incident, newest first.
     *
     * @param limit maximum rows, null for the configured default
     */
    @Transactional(readOnly = true)
    public List<ReportRow> exportTable(ReportFilter filter, Integer limit) {
        return metrics.timeReport("table", () -> toRows(scope.newest(filter, effectiveLimit(limit))));
    }

    @Transactional(readOnly = true)
    public String exportCsv(ReportFilter filter, Integer limit) {
        List<ReportRow> rows = exportTable(filter, limit);
        log.debug("Exporting {} incidents as CSV", rows.size());
        return CsvEncoder.encode(ReportRow.COLUMNS, rows.stream().map(ReportRow::cells).toList());
    }

    /**
     * KPI summary followed by the latest incidents of the filter.
     */
    @Transactional(readOnly = true)
    public RenderedDocument exportDocument(ReportFilter filter) {
        KpiSnapshot kpis = metricsAggregator.getKpis(filter);
        List<ReportRow> rows = toRows(scope.newest(filter, properties.getReports().getDocumentMaxRows()));

        ReportDocument.Section.SectionBuilder scopeSection = ReportDocument.Section.builder().heading("Scope")
                .line("From: " + orDash(filter.getFrom()))
                .line("To: " + orDash(filter.getTo()))
                .line("Team: " + orDash(filter.getTeamId() == null ? null : directory.teamLabel(filter.getTeamId())))
                .line("Service: " + orDash(filter.getServiceId()))
                .line("Severity: " + orDash(filter.getSeverity()));

        ReportDocument.Section.SectionBuilder kpiSection = ReportDocument.Section.builder().heading("KPIs")
                .line("Open: " + kpis.getOpenCount())
                .line("Resolved: " + kpis.getResolvedCount())
                .line("Closed: " + kpis.getClosedCount())
                .line("MTTR avg (s): " + orDash(kpis.getMttrSeconds().getAvg()))
                .line("MTTR median (s): " + orDash(kpis.getMttrSeconds().getMedian()))
                .line("MTTR p90 (s): " + orDash(kpis.getMttrSeconds().getP90()))
                .line("SLA compliance (%): " + orDash(kpis.getSlaCompliancePct()));

        ReportDocument.Section.SectionBuilder incidentSection = ReportDocument.Section.builder()
                .heading("Latest incidents (" + rows.size() + ")");
        for (ReportRow row : rows) {
            incidentSection.line(String.format("%s | %s | %s | %s | %s | %s",
                    row.getCreatedAt(), row.getSeverity(), row.getStatus(), orDash(row.getTeam()),
                    orDash(row.getAssignee()), row.getTitle()));
        }

        ReportDocument document = ReportDocument.builder()
                .title("Incident report")
                .generatedAt(Instant.now(clock))
                .section(scopeSection.build())
                .section(kpiSection.build())
                .section(incidentSection.build())
                .build();
        return render(document, "incident-report");
    }

    /**
     * Full audit document of one incident. When auditing is enabled the stored hash is checked
     * first, and an incident that was never hashed gets hashed.
     */
    @Transactional
    public RenderedDocument exportIncidentDocument(String incidentId) {
        Incident incident = incidentQueryService.getIncident(incidentId);
        auditHashService.verify(incident);

        List<TimelineEvent> timeline = incidentQueryService.listTimeline(incidentId);
        List<IncidentComment> comments = incidentQueryService.listComments(incidentId);

        Set<String> userIds = new HashSet<>();
        userIds.add(incident.getReporterId());
        userIds.add(incident.getAssigneeId());
        timeline.forEach(e -> userIds.add(e.getAuthorId()));
        comments.forEach(c -> userIds.add(c.getAuthorId()));
        Map<String, String> users = directory.userLabels(userIds);
        ReportRow row = toRows(List.of(incident)).get(0);

        ReportDocument.Section.SectionBuilder details = ReportDocument.Section.builder().heading("Details")
                .line("ID: " + incident.getId())
                .line("Title: " + incident.getTitle())
                .line("Status: " + incident.getStatus())
                .line("Severity: " + incident.getSeverity())
                .line("Team: " + orDash(row.getTeam()))
                .line("Service: " + orDash(row.getService()))
                .line("Reporter: " + orDash(row.getReporter()))
                .line("Assignee: " + orDash(row.getAssignee()))
                .line("Created: " + incident.getCreatedAt())
                .line("Triaged: " + orDash(incident.getTriagedAt()))
                .line("In progress: " + orDash(incident.getInProgressAt()))
                .line("Resolved: " + orDash(incident.getResolvedAt()))
                .line("Closed: " + orDash(incident.getClosedAt()))
                .line("MTTR (s): " + orDash(row.getMttrSeconds()))
                .line("SLA met: " + orDash(row.getSlaMet()));

        ReportDocument.Section.SectionBuilder timelineSection = ReportDocument.Section.builder().heading("Timeline");
        for (TimelineEvent event : timeline) {
            String transition = event.getType() == TimelineEventType.STATUS_CHANGE
                    ? " [" + orDash(event.getFromStatus()) + " → " + event.getToStatus() + "]"
                    : "";
            timelineSection.line(String.format("%s | %s%s | %s | %s", event.getCreatedAt(), event.getType(),
                    transition, users.getOrDefault(event.getAuthorId(), event.getAuthorId()), orDash(event.getMessage())));
        }

        ReportDocument.Section.SectionBuilder commentSection = ReportDocument.Section.builder().heading("Comments");
        for (IncidentComment comment : comments) {
            commentSection.line(String.format("%s | %s | %s", comment.getCreatedAt(),
                    users.getOrDefault(comment.getAuthorId(), comment.getAuthorId()), comment.getBody()));
        }

        ReportDocument.Section.SectionBuilder integrity = ReportDocument.Section.builder().heading("Integrity");
        if (auditHashService.isEnabled()) {
            integrity.line("Algorithm: HMAC-SHA256")
                    .line("Hash: " + incident.getAuditHash())
                    .line("Hashed at: " + orDash(incident.getAuditHashUpdatedAt()));
        } else {
            integrity.line("Audit hashing disabled");
        }

        ReportDocument document = ReportDocument.builder()
                .title("Incident " + incident.getTitle())
                .generatedAt(Instant.now(clock))
                .section(details.build())
                .section(ReportDocument.Section.builder().heading("Description").line(incident.getDescription()).build())
                .section(ReportDocument.Section.builder().heading("Categories")
                        .lines(row.getCategories()).build())
                .section(ReportDocument.Section.builder().heading("Tags")
                        .lines(row.getTags()).build())
                .section(timelineSection.build())
                .section(commentSection.build())
                .section(integrity.build())
                .build();
        return render(document, "incident-" + incident.getId());
    }

    List<ReportRow> toRows(List<Incident> incidents) {
        Set<String> teamIds = new HashSet<>();
        Set<String> serviceIds = new HashSet<>();
        Set<String> userIds = new HashSet<>();
        Set<String> categoryIds = new HashSet<>();
        Set<String> tagIds = new HashSet<>();
        for (Incident incident : incidents) {
            teamIds.add(incident.getTeamId());
            serviceIds.add(incident.getPrimaryServiceId());
            userIds.add(incident.getAssigneeId());
            userIds.add(incident.getReporterId());
            categoryIds.addAll(incident.getCategoryIds());
            tagIds.addAll(incident.getTagIds());
        }
        Map<String, String> teams = directory.teamLabels(teamIds);
        Map<String, String> services = directory.serviceLabels(serviceIds);
        Map<String, String> users = directory.userLabels(userIds);
        Map<String, String> categories = directory.categoryLabels(categoryIds);
        Map<String, String> tags = directory.tagLabels(tagIds);

        List<ReportRow> rows = new ArrayList<>(incidents.size());
        for (Incident incident : incidents) {
            Duration ttr = SlaPolicy.timeToResolve(incident);
            Duration target = slaPolicy.targetFor(incident.getSeverity());
            rows.add(ReportRow.builder()
                    .id(incident.getId())
                    .createdAt(incident.getCreatedAt())
                    .title(incident.getTitle())
                    .severity(incident.getSeverity())
                    .status(incident.getStatus())
                    .team(label(teams, incident.getTeamId()))
                    .service(label(services, incident.getPrimaryServiceId()))
                    .assignee(label(users, incident.getAssigneeId()))
                    .reporter(label(users, incident.getReporterId()))
                    .mttrSeconds(ttr == null ? null : ttr.getSeconds())
                    .slaTargetSeconds(target.getSeconds())
                    .slaMet(slaPolicy.isMet(incident))
                    .resolvedAt(incident.getResolvedAt())
                    .closedAt(incident.getClosedAt())
                    .categories(sortedLabels(categories, incident.getCategoryIds()))
                    .tags(sortedLabels(tags, incident.getTagIds()))
                    .build());
        }
        return rows;
    }

    private int effectiveLimit(Integer limit) {
        VigilProperties.Reports reports = properties.getReports();
        if (limit == null) {
            return Math.min(reports.getExportDefaultLimit(), reports.getExportMaxLimit());
        }
        if (limit < 1 || limit > reports.getExportMaxLimit()) {
            throw new RequestValidationException("limit must be between 1 and " + reports.getExportMaxLimit());
        }
        return limit;
    }

    private RenderedDocument render(ReportDocument document, String baseName) {
        return RenderedDocument.builder()
                .content(documentRenderer.render(document))
                .contentType(documentRenderer.contentType())
                .fileName(baseName + "." + documentRenderer.fileExtension())
                .build();
    }

    private static String label(Map<String, String> labels, String id) {
        return id == null ? null : labels.getOrDefault(id, id);
    }

    private static List<String> sortedLabels(Map<String, String> labels, Collection<String> ids) {
        return ids.stream().map(id -> labels.getOrDefault(id, id)).sorted().collect(Collectors.toList());
    }

    private static String orDash(Object value) {
        return value == null ? "-" : value.toString();
    }
}
