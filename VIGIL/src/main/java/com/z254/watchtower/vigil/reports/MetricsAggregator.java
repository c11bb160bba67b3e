package com.z254.watchtower.vigil.reports;

import com.z254.watchtower.vigil.domain.model.Incident;
import com.z254.watchtower.vigil.domain.model.IncidentStatus;
import com.z254.watchtower.vigil.observability.VigilMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Computes {@link KpiSnapshot}s.
 * <p>
 * MTTR samples are {@code resolvedAt - createdAt} for every incident carrying a resolution
 * time, whatever its current status, so a reopened incident keeps counting with its first
 * resolution.
 */
@Slf4j
@Service
public class MetricsAggregator {

    private final ReportScope scope;
    private final SlaPolicy slaPolicy;
    private final VigilMetrics metrics;

    public MetricsAggregator(ReportScope scope, SlaPolicy slaPolicy, VigilMetrics metrics) {
        this.scope = scope;
        this.slaPolicy = slaPolicy;
        this.metrics = metrics;
    }

    @Transactional(readOnly = true)
    public KpiSnapshot getKpis(ReportFilter filter) {
        return metrics.timeReport("kpis", () -> computeKpis(scope.incidents(filter)));
    }

    public KpiSnapshot computeKpis(List<Incident> incidents) {
        long open = 0;
        long resolved = 0;
        long closed = 0;
        long slaMet = 0;
        List<Double> samples = new ArrayList<>();

        for (Incident incident : incidents) {
            IncidentStatus status = incident.getStatus();
            if (status.isOpen()) {
                open++;
            }
            if (status == IncidentStatus.CLOSED) {
                closed++;
            }
            if (incident.getResolvedAt() != null && status.countsAsResolved()) {
                resolved++;
            }

            Duration ttr = SlaPolicy.timeToResolve(incident);
            if (ttr != null) {
                samples.add(ttr.toMillis() / 1000.0);
                if (ttr.compareTo(slaPolicy.targetFor(incident.getSeverity())) <= 0) {
                    slaMet++;
                }
            }
        }

        Collections.sort(samples);
        KpiSnapshot.MttrStats mttr = samples.isEmpty()
                ? KpiSnapshot.MttrStats.empty()
                : KpiSnapshot.MttrStats.builder()
                        .avg(Percentiles.mean(samples))
                        .median(Percentiles.percentile(samples, 0.5))
                        .p90(Percentiles.percentile(samples, 0.9))
                        .build();

        Double slaPct = samples.isEmpty() ? null : Math.round(slaMet * 1000.0 / samples.size()) / 10.0;

        log.debug("KPIs over {} incidents: open={}, resolved={}, closed={}", incidents.size(), open, resolved, closed);
        return KpiSnapshot.builder()
                .openCount(open)
                .resolvedCount(resolved)
                .closedCount(closed)
                .mttrSeconds(mttr)
                .slaCompliancePct(slaPct)
                .build();
    }
}
