package com.z254.watchtower.vigil.reports;

import com.z254.watchtower.vigil.config.VigilProperties;
import com.z254.watchtower.vigil.domain.model.Incident;
import com.z254.watchtower.vigil.domain.model.IncidentStatus;
import com.z254.watchtower.vigil.domain.model.Severity;
import com.z254.watchtower.vigil.observability.VigilMetrics;
import com.z254.watchtower.vigil.support.Incidents;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MetricsAggregatorTest {

    private static final Instant T0 = Instant.parse("2025-01-06T00:00:00Z");

    @Mock
    private ReportScope scope;

    private SimpleMeterRegistry meterRegistry;
    private MetricsAggregator aggregator;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        aggregator = new MetricsAggregator(scope, new SlaPolicy(new VigilProperties()), new VigilMetrics(meterRegistry));
    }

    @Test
    void computesCountsMttrAndSla() {
        List<Incident> incidents = List.of(
                Incidents.resolved(Severity.SEV1, T0, Duration.ofMinutes(30), IncidentStatus.RESOLVED),
                Incidents.resolved(Severity.SEV2, T0, Duration.ofHours(2), IncidentStatus.CLOSED),
                Incidents.resolved(Severity.SEV3, T0, Duration.ofHours(4), IncidentStatus.REOPENED),
                Incidents.open(Severity.SEV2, T0),
                inProgress(Incidents.open(Severity.SEV4, T0)));
        ReportFilter filter = ReportFilter.all();
        when(scope.incidents(filter)).thenReturn(incidents);

        KpiSnapshot kpis = aggregator.getKpis(filter);

        assertThat(kpis.getOpenCount()).isEqualTo(3);
        assertThat(kpis.getResolvedCount()).isEqualTo(3);
        assertThat(kpis.getClosedCount()).isEqualTo(1);
        assertThat(kpis.getMttrSeconds().getAvg()).isEqualTo(7800.0);
        assertThat(kpis.getMttrSeconds().getMedian()).isEqualTo(7200.0);
        assertThat(kpis.getMttrSeconds().getP90()).isCloseTo(12960.0, within(1e-6));
        assertThat(kpis.getSlaCompliancePct()).isEqualTo(100.0);
        assertThat(meterRegistry.find("vigil.reports.duration").tag("report", "kpis").timer()).isNotNull();
    }

    @Test
    void roundsSlaComplianceToOneDecimal() {
        KpiSnapshot kpis = aggregator.computeKpis(List.of(
                Incidents.resolved(Severity.SEV1, T0, Duration.ofMinutes(30), IncidentStatus.RESOLVED),
                Incidents.resolved(Severity.SEV1, T0, Duration.ofHours(1), IncidentStatus.RESOLVED),
                Incidents.resolved(Severity.SEV2, T0, Duration.ofHours(3), IncidentStatus.RESOLVED)));

        assertThat(kpis.getSlaCompliancePct()).isEqualTo(33.3);
    }

    @Test
    void targetIsInclusive() {
        KpiSnapshot kpis = aggregator.computeKpis(List.of(
                Incidents.resolved(Severity.SEV1, T0, Duration.ofMinutes(45), IncidentStatus.RESOLVED)));

        assertThat(kpis.getSlaCompliancePct()).isEqualTo(100.0);
    }

    @Test
    void resolutionTimeCountsAfterWorkResumes() {
        Incident reworked = Incidents.resolved(Severity.SEV3, T0, Duration.ofHours(1), IncidentStatus.IN_PROGRESS);

        KpiSnapshot kpis = aggregator.computeKpis(List.of(reworked));

        assertThat(kpis.getOpenCount()).isEqualTo(1);
        assertThat(kpis.getResolvedCount()).isZero();
        assertThat(kpis.getMttrSeconds().getAvg()).isEqualTo(3600.0);
    }

    @Test
    void emptyPopulationHasNoMttrOrSla() {
        KpiSnapshot kpis = aggregator.computeKpis(List.of());

        assertThat(kpis.getOpenCount()).isZero();
        assertThat(kpis.getResolvedCount()).isZero();
        assertThat(kpis.getClosedCount()).isZero();
        assertThat(kpis.getMttrSeconds().getAvg()).isNull();
        assertThat(kpis.getMttrSeconds().getMedian()).isNull();
        assertThat(kpis.getMttrSeconds().getP90()).isNull();
        assertThat(kpis.getSlaCompliancePct()).isNull();
    }

    @Test
    void configuredTargetOverridesDefault() {
        VigilProperties properties = new VigilProperties();
        properties.getSla().getTargets().put(Severity.SEV3, Duration.ofMinutes(30));
        MetricsAggregator strict = new MetricsAggregator(scope, new SlaPolicy(properties),
                new VigilMetrics(new SimpleMeterRegistry()));

        KpiSnapshot kpis = strict.computeKpis(List.of(
                Incidents.resolved(Severity.SEV3, T0, Duration.ofHours(1), IncidentStatus.RESOLVED)));

        assertThat(kpis.getSlaCompliancePct()).isEqualTo(0.0);
    }

    private static Incident inProgress(Incident incident) {
        incident.setStatus(IncidentStatus.IN_PROGRESS);
        return incident;
    }
}
