package com.z254.watchtower.vigil.notification;

import com.z254.watchtower.vigil.config.VigilProperties;
import com.z254.watchtower.vigil.domain.model.Severity;
import com.z254.watchtower.vigil.observability.VigilMetrics;
import com.z254.watchtower.vigil.observability.VigilStructuredLogger;
import com.z254.watchtower.vigil.observability.VigilStructuredLogger.IncidentEventType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NotificationTriggerTest {

    @Mock
    private NotificationGateway gateway;
    @Mock
    private IntegrationSettingsService integrationSettings;
    @Mock
    private VigilMetrics metrics;
    @Mock
    private VigilStructuredLogger structuredLogger;

    private VigilProperties properties;
    private NotificationTrigger trigger;

    @BeforeEach
    void setUp() {
        properties = new VigilProperties();
        properties.getNotifications().setPublicBaseUrl("https://vigil.example.test/");
        properties.getNotifications().getChannels().add(channel("ops-chat", ChannelKind.CHAT_WEBHOOK, true));
        properties.getNotifications().getChannels().add(channel("pager", ChannelKind.PAGING, true));
        properties.getNotifications().getChannels().add(channel("legacy", ChannelKind.CHAT_WEBHOOK, false));
        trigger = new NotificationTrigger(gateway, integrationSettings, properties, metrics, structuredLogger);
    }

    private static VigilProperties.Notifications.Channel channel(String name, ChannelKind kind, boolean enabled) {
        VigilProperties.Notifications.Channel channel = new VigilProperties.Notifications.Channel();
        channel.setName(name);
        channel.setKind(kind);
        channel.setUrl("https://hooks.example.test/" + name);
        channel.setRoutingKey("routing-" + name);
        channel.setEnabled(enabled);
        return channel;
    }

    private static IncidentCreatedEvent created(Severity severity) {
        return new IncidentCreatedEvent("inc-42", "Payments down", severity, "user-reporter",
                Instant.parse("2025-01-06T08:00:00Z"));
    }

    @ParameterizedTest
    @CsvSource({"SEV1,true", "SEV2,true", "SEV3,false", "SEV4,false"})
    void notifiesOnlyHighSeverity(Severity severity, boolean expected) {
        assertThat(NotificationTrigger.shouldNotify(severity)).isEqualTo(expected);
    }

    @Test
    void sendsToEveryEnabledChannelWithDeepLink() {
        when(integrationSettings.isEnabled(eq("user-reporter"), any())).thenReturn(true);
        when(gateway.send(any(), any())).thenReturn(Mono.empty());

        trigger.onIncidentCreated(created(Severity.SEV1));

        ArgumentCaptor<NotificationMessage> message = ArgumentCaptor.forClass(NotificationMessage.class);
        verify(gateway, times(2)).send(message.capture(), any());
        verify(gateway, never()).send(any(), argThat(d -> "legacy".equals(d.getName())));
        assertThat(message.getValue().getLink()).isEqualTo("https://vigil.example.test/incidents/inc-42");
        assertThat(message.getValue().toText())
                .startsWith("🚨 **SEV1** New incident: Payments down")
                .contains("ID: inc-42");
        verify(metrics).recordNotificationSent(ChannelKind.CHAT_WEBHOOK);
        verify(metrics).recordNotificationSent(ChannelKind.PAGING);
    }

    @Test
    void staysQuietForLowSeverity() {
        trigger.onIncidentCreated(created(Severity.SEV3));

        verify(gateway, never()).send(any(), any());
    }

    @Test
    void failedDeliveryIsCountedAndSwallowed() {
        when(integrationSettings.isEnabled(eq("user-reporter"), any())).thenReturn(true);
        when(gateway.send(any(), any())).thenAnswer(invocation -> {
            NotificationDestination destination = invocation.getArgument(1);
            return destination.getKind() == ChannelKind.CHAT_WEBHOOK
                    ? Mono.error(new IllegalStateException("503 from webhook"))
                    : Mono.empty();
        });

        assertThatCode(() -> trigger.onIncidentCreated(created(Severity.SEV2))).doesNotThrowAnyException();

        verify(metrics).recordNotificationFailed(ChannelKind.CHAT_WEBHOOK);
        verify(metrics).recordNotificationSent(ChannelKind.PAGING);
    }

    @Test
    void synchronousGatewayErrorDoesNotStopOtherChannels() {
        when(gateway.send(any(), any())).thenAnswer(invocation -> {
            NotificationDestination destination = invocation.getArgument(1);
            if (destination.getKind() == ChannelKind.CHAT_WEBHOOK) {
                throw new IllegalArgumentException("bad url");
            }
            return Mono.empty();
        });

        int attempted = trigger.dispatch(NotificationMessage.builder()
                .incidentId("inc-42")
                .title("Payments down")
                .severity(Severity.SEV1)
                .link("https://vigil.example.test/incidents/inc-42")
                .build());

        assertThat(attempted).isEqualTo(2);
        verify(metrics).recordNotificationFailed(ChannelKind.CHAT_WEBHOOK);
        verify(metrics).recordNotificationSent(ChannelKind.PAGING);
    }

    @Test
    void skipsChannelKindTheReporterSwitchedOff() {
        when(integrationSettings.isEnabled("user-reporter", ChannelKind.CHAT_WEBHOOK)).thenReturn(true);
        when(integrationSettings.isEnabled("user-reporter", ChannelKind.PAGING)).thenReturn(false);
        when(gateway.send(any(), any())).thenReturn(Mono.empty());

        trigger.onIncidentCreated(created(Severity.SEV1));

        verify(gateway).send(any(), argThat(d -> "ops-chat".equals(d.getName())));
        verify(gateway, never()).send(any(), argThat(d -> d.getKind() == ChannelKind.PAGING));
        verify(structuredLogger).logIncidentEvent(eq("inc-42"), eq("user-reporter"),
                eq(IncidentEventType.NOTIFICATION_SKIPPED), any(), eq(Map.of("channel", "pager")));
    }

    @Test
    void reporterWithEverythingOffGetsNothing() {
        when(integrationSettings.isEnabled(eq("user-reporter"), any())).thenReturn(false);

        trigger.onIncidentCreated(created(Severity.SEV1));

        verify(gateway, never()).send(any(), any());
    }

    @Test
    void unreadableSettingsStillNotify() {
        when(integrationSettings.isEnabled(eq("user-reporter"), any()))
                .thenThrow(new IllegalStateException("connection refused"));
        when(gateway.send(any(), any())).thenReturn(Mono.empty());

        trigger.onIncidentCreated(created(Severity.SEV2));

        verify(gateway, times(2)).send(any(), any());
    }

    @Test
    void noChannelsMeansNothingToDo() {
        properties.getNotifications().getChannels().clear();

        assertThat(trigger.dispatch(NotificationMessage.builder().incidentId("inc-42").build())).isZero();
        verify(gateway, never()).send(any(), any());
    }

    @Test
    void deepLinkWithoutTrailingSlash() {
        properties.getNotifications().setPublicBaseUrl("https://vigil.example.test");

        assertThat(trigger.deepLink("abc")).isEqualTo("https://vigil.example.test/incidents/abc");
    }
}
