package com.z254.watchtower.vigil.ingestion;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AlertIngestionServiceTest {

    private static final Instant NOW = Instant.parse("2025-01-06T09:00:00Z");
    private static final String ACTOR = "alert-ingestion";

    @Mock
    private IncidentStateMachine stateMachine;
    @Mock
    private IncidentSourceRepository sourceRepository;
    @Mock
    private DirectoryLabels directory;
    @Mock
    private VigilMetrics metrics;
    @Mock
    private VigilStructuredLogger structuredLogger;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private AlertIngestionService ingestionService;

    @BeforeEach
    void setUp() {
        ingestionService = new AlertIngestionService(stateMachine, sourceRepository, directory,
                new VigilProperties(), metrics, structuredLogger, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private JsonNode json(String singleQuoted) throws Exception {
        return objectMapper.readTree(singleQuoted.replace('\'', '"'));
    }

    @Test
    void newAlertOpensIncidentAndRemembersSource() throws Exception {
        JsonNode payload = json("{'title':'High latency SEV2 on checkout','text':'p99 above 2s',"
                + "'alert_id':12345,'tags':['service:payments-api','env:prod']}");
        when(sourceRepository.findByIntegrationAndExternalId("monitoring", "12345")).thenReturn(Optional.empty());
        when(directory.findServiceIdByKey("payments-api")).thenReturn(Optional.of("svc-pay"));
        when(stateMachine.createIncident(any(IncidentDraft.class), eq(ACTOR)))
                .thenReturn(Incident.builder().id("inc-1").build());

        AlertIngestionResult result = ingestionService.ingest(payload);

        assertThat(result).isEqualTo(new AlertIngestionResult("inc-1", true));

        ArgumentCaptor<IncidentDraft> draft = ArgumentCaptor.forClass(IncidentDraft.class);
        verify(stateMachine).createIncident(draft.capture(), eq(ACTOR));
        assertThat(draft.getValue().getTitle()).isEqualTo("High latency SEV2 on checkout");
        assertThat(draft.getValue().getDescription()).isEqualTo("p99 above 2s");
        assertThat(draft.getValue().getSeverity()).isEqualTo(Severity.SEV2);
        assertThat(draft.getValue().getPrimaryServiceId()).isEqualTo("svc-pay");

        ArgumentCaptor<IncidentSource> source = ArgumentCaptor.forClass(IncidentSource.class);
        verify(sourceRepository).saveAndFlush(source.capture());
        assertThat(source.getValue().getIntegration()).isEqualTo("monitoring");
        assertThat(source.getValue().getExternalId()).isEqualTo("12345");
        assertThat(source.getValue().getIncidentId()).isEqualTo("inc-1");
        assertThat(source.getValue().getPayload()).contains("\"alert_id\":12345");
        assertThat(source.getValue().getCreatedAt()).isEqualTo(NOW);

        verify(stateMachine).addComment("inc-1", "Alert received: High latency SEV2 on checkout", ACTOR);
        verify(metrics).recordAlertIngested(true);
        verify(structuredLogger).logIncidentEvent(eq("inc-1"), eq(ACTOR), eq(IncidentEventType.ALERT_INGESTED),
                any(), any());
    }

    @Test
    void repeatedAlertOnlyCommentsOnKnownIncident() throws Exception {
        JsonNode payload = json("{'title':'High latency SEV2 on checkout','alert_id':'12345'}");
        when(sourceRepository.findByIntegrationAndExternalId("monitoring", "12345"))
                .thenReturn(Optional.of(IncidentSource.builder().incidentId("inc-1").externalId("12345").build()));

        AlertIngestionResult result = ingestionService.ingest(payload);

        assertThat(result).isEqualTo(new AlertIngestionResult("inc-1", false));
        verify(stateMachine).addComment("inc-1", "Alert update: High latency SEV2 on checkout", ACTOR);
        verify(stateMachine, never()).createIncident(any(), any());
        verify(sourceRepository, never()).saveAndFlush(any());
        verify(metrics).recordAlertIngested(false);
        verify(structuredLogger).logIncidentEvent(eq("inc-1"), eq(ACTOR), eq(IncidentEventType.ALERT_DEDUPLICATED),
                any(), any());
        verifyNoInteractions(directory);
    }

    @Test
    void fallsBackThroughIdFields() throws Exception {
        JsonNode payload = json("{'title':'Disk full','alert_id':'  ','event_id':'evt-9','id':'ignored'}");
        when(sourceRepository.findByIntegrationAndExternalId("monitoring", "evt-9"))
                .thenReturn(Optional.of(IncidentSource.builder().incidentId("inc-2").build()));

        assertThat(ingestionService.ingest(payload).incidentId()).isEqualTo("inc-2");
    }

    @Test
    void alertWithoutIdAlwaysOpensIncidentWithDefaults() throws Exception {
        JsonNode payload = json("{'message':'','tags':'service:unknown-svc'}");
        when(directory.findServiceIdByKey("unknown-svc")).thenReturn(Optional.empty());
        when(stateMachine.createIncident(any(IncidentDraft.class), eq(ACTOR)))
                .thenReturn(Incident.builder().id("inc-3").build());

        AlertIngestionResult result = ingestionService.ingest(payload);

        assertThat(result.created()).isTrue();
        ArgumentCaptor<IncidentDraft> draft = ArgumentCaptor.forClass(IncidentDraft.class);
        verify(stateMachine).createIncident(draft.capture(), eq(ACTOR));
        assertThat(draft.getValue().getTitle()).isEqualTo(AlertIngestionService.DEFAULT_TITLE);
        assertThat(draft.getValue().getDescription()).isEqualTo(AlertIngestionService.DEFAULT_TITLE);
        assertThat(draft.getValue().getSeverity()).isEqualTo(Severity.SEV3);
        assertThat(draft.getValue().getPrimaryServiceId()).isNull();
        verifyNoInteractions(sourceRepository);
        verify(stateMachine).addComment("inc-3", "Alert received: " + AlertIngestionService.DEFAULT_TITLE, ACTOR);
    }

    @Test
    void severityTagOverridesTitle() throws Exception {
        JsonNode payload = json("{'title':'SEV1 checkout down','text':'all pods crashlooping',"
                + "'tags':'severity:sev-4, env:staging'}");
        when(stateMachine.createIncident(any(IncidentDraft.class), eq(ACTOR)))
                .thenReturn(Incident.builder().id("inc-4").build());

        ingestionService.ingest(payload);

        ArgumentCaptor<IncidentDraft> draft = ArgumentCaptor.forClass(IncidentDraft.class);
        verify(stateMachine).createIncident(draft.capture(), eq(ACTOR));
        assertThat(draft.getValue().getSeverity()).isEqualTo(Severity.SEV4);
        verifyNoInteractions(directory);
    }

    @Test
    void oversizedPayloadIsNotStored() throws Exception {
        String text = "x".repeat(IncidentSource.MAX_PAYLOAD_LENGTH);
        JsonNode payload = json("{'title':'Noisy','alert_id':'big','text':'" + text + "'}");
        when(sourceRepository.findByIntegrationAndExternalId("monitoring", "big")).thenReturn(Optional.empty());
        when(stateMachine.createIncident(any(IncidentDraft.class), eq(ACTOR)))
                .thenReturn(Incident.builder().id("inc-5").build());

        ingestionService.ingest(payload);

        ArgumentCaptor<IncidentSource> source = ArgumentCaptor.forClass(IncidentSource.class);
        verify(sourceRepository).saveAndFlush(source.capture());
        assertThat(source.getValue().getPayload()).isNull();
        ArgumentCaptor<IncidentDraft> draft = ArgumentCaptor.forClass(IncidentDraft.class);
        verify(stateMachine).createIncident(draft.capture(), eq(ACTOR));
        assertThat(draft.getValue().getDescription()).hasSize(AlertIngestionService.MAX_DESCRIPTION_LENGTH);
    }

    @Test
    void rejectsNonObjectPayload() throws Exception {
        assertThatThrownBy(() -> ingestionService.ingest(json("['not','an','object']")))
                .isInstanceOf(RequestValidationException.class);
        verifyNoInteractions(stateMachine, sourceRepository);
    }
}
