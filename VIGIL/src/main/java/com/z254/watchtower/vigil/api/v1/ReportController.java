package com.z254.watchtower.vigil.api.v1;

import com.z254.watchtower.vigil.reports.*;
import com.z254.watchtower.vigil.reports.export.RenderedDocument;
import com.z254.watchtower.vigil.reports.export.ReportExporter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * REST API controller for operational reports.
 * <p>
 * Every endpoint accepts the same filter parameters: {@code from}, {@code to}, {@code lastDays},
 * {@code teamId}, {@code serviceId} and {@code severity}.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/reports")
@Tag(name = "Reports", description = "Operational metrics and exports")
public class ReportController {

    static final MediaType TEXT_CSV = new MediaType("text", "csv", java.nio.charset.StandardCharsets.UTF_8);

    private final MetricsAggregator metricsAggregator;
    private final BreakdownEngine breakdownEngine;
    private final TimeseriesEngine timeseriesEngine;
    private final ReportExporter reportExporter;
    private final Clock clock;

    public ReportController(MetricsAggregator metricsAggregator,
                            BreakdownEngine breakdownEngine,
                            TimeseriesEngine timeseriesEngine,
                            ReportExporter reportExporter,
                            Clock clock) {
        this.metricsAggregator = metricsAggregator;
        this.breakdownEngine = breakdownEngine;
        this.timeseriesEngine = timeseriesEngine;
        this.reportExporter = reportExporter;
        this.clock = clock;
    }

    @GetMapping("/kpis")
    @Operation(summary = "KPIs", description = "Open/resolved/closed counts, MTTR statistics and SLA compliance")
    public Mono<ResponseEntity<KpiSnapshot>> kpis(
            @Parameter(description = "Created at or after (ISO-8601 instant or date)") @RequestParam(required = false) String from,
            @Parameter(description = "Created before (ISO-8601 instant or date)") @RequestParam(required = false) String to,
            @Parameter(description = "Look-back window in days when from is absent") @RequestParam(required = false) Integer lastDays,
            @Parameter(description = "Team id") @RequestParam(required = false) String teamId,
            @Parameter(description = "Primary service id") @RequestParam(required = false) String serviceId,
            @Parameter(description = "Severity (SEV1..SEV4)") @RequestParam(required = false) String severity) {

        return blocking(() -> ResponseEntity.ok(metricsAggregator.getKpis(
                ReportFilter.parse(from, to, lastDays, teamId, serviceId, severity, clock))));
    }

    @GetMapping("/breakdown")
    @Operation(summary = "Breakdown", description = "Incident counts grouped by a dimension, largest first")
    public Mono<ResponseEntity<List<BreakdownItem>>> breakdown(
            @Parameter(description = "severity, status, team, service, category or assignee") @RequestParam String groupBy,
            @RequestParam(required = false) String from,
            @RequestParam(required = false) String to,
            @RequestParam(required = false) Integer lastDays,
            @RequestParam(required = false) String teamId,
            @RequestParam(required = false) String serviceId,
            @RequestParam(required = false) String severity) {

        return blocking(() -> ResponseEntity.ok(breakdownEngine.getBreakdown(
                ReportFilter.parse(from, to, lastDays, teamId, serviceId, severity, clock),
                GroupBy.fromParam(groupBy))));
    }

    @GetMapping("/timeseries")
    @Operation(summary = "Timeseries", description = "Incidents created per day or week (UTC), gaps filled with zero")
    public Mono<ResponseEntity<List<TimeseriesPoint>>> timeseries(
            @Parameter(description = "day or week") @RequestParam(defaultValue = "day") String interval,
            @RequestParam(required = false) String from,
            @RequestParam(required = false) String to,
            @RequestParam(required = false) Integer lastDays,
            @RequestParam(required = false) String teamId,
            @RequestParam(required = false) String serviceId,
            @RequestParam(required = false) String severity) {

        return blocking(() -> ResponseEntity.ok(timeseriesEngine.getTimeseries(
                ReportFilter.parse(from, to, lastDays, teamId, serviceId, severity, clock),
                Interval.fromParam(interval))));
    }

    @GetMapping("/export.csv")
    @Operation(summary = "CSV export", description = "One row per incident, newest first")
    public Mono<ResponseEntity<String>> exportCsv(
            @RequestParam(required = false) String from,
            @RequestParam(required = false) String to,
            @RequestParam(required = false) Integer lastDays,
            @RequestParam(required = false) String teamId,
            @RequestParam(required = false) String serviceId,
            @RequestParam(required = false) String severity,
            @Parameter(description = "Maximum rows") @RequestParam(required = false) Integer limit) {

        return blocking(() -> {
            String csv = reportExporter.exportCsv(
                    ReportFilter.parse(from, to, lastDays, teamId, serviceId, severity, clock), limit);
            return ResponseEntity.ok()
                    .contentType(TEXT_CSV)
                    .header(HttpHeaders.CONTENT_DISPOSITION,
                            ContentDisposition.attachment().filename("incidents.csv").build().toString())
                    .body(csv);
        });
    }

    @GetMapping("/export.document")
    @Operation(summary = "Document export",
               description = "Rendered report for the filter, or the audit document of one incident when incidentId is given")
    public Mono<ResponseEntity<byte[]>> exportDocument(
            @Parameter(description = "Export a single incident instead of a report") @RequestParam(required = false) String incidentId,
            @RequestParam(required = false) String from,
            @RequestParam(required = false) String to,
            @RequestParam(required = false) Integer lastDays,
            @RequestParam(required = false) String teamId,
            @RequestParam(required = false) String serviceId,
            @RequestParam(required = false) String severity) {

        return blocking(() -> {
            RenderedDocument document = incidentId != null
                    ? reportExporter.exportIncidentDocument(incidentId)
                    : reportExporter.exportDocument(
                            ReportFilter.parse(from, to, lastDays, teamId, serviceId, severity, clock));
            return ResponseEntity.ok()
                    .contentType(MediaType.parseMediaType(document.getContentType()))
                    .header(HttpHeaders.CONTENT_DISPOSITION,
                            ContentDisposition.attachment().filename(document.getFileName()).build().toString())
                    .body(document.getContent());
        });
    }

    private static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }
}
