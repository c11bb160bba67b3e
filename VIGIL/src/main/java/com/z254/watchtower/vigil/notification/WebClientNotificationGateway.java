package com.z254.watchtower.vigil.notification;

import com.z254.watchtower.vigil.config.VigilProperties;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP delivery to chat webhooks and to an Events v2 paging endpoint.
 */
@Slf4j
@Component
public class WebClientNotificationGateway implements NotificationGateway {

    static final String SOURCE = "vigil";

    private final WebClient webClient;
    private final Duration timeout;

    public WebClientNotificationGateway(WebClient.Builder webClientBuilder,
                                        VigilProperties vigilProperties) {
        this.webClient = webClientBuilder.build();
        this.timeout = vigilProperties.getNotifications().getTimeout();
    }

    @Override
    @CircuitBreaker(name = "notification-gateway")
    @Retry(name = "notification-gateway")
    public Mono<Void> send(NotificationMessage message, NotificationDestination destination) {
        Map<String, Object> body = switch (destination.getKind()) {
            case CHAT_WEBHOOK -> chatPayload(message);
            case PAGING -> pagingPayload(message, destination);
        };

        return webClient.post()
                .uri(destination.getUrl())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .toBodilessEntity()
                .timeout(timeout)
                .doOnSuccess(response -> log.debug("Notification for incident {} delivered to {}",
                        message.getIncidentId(), destination.getName()))
                .then();
    }

    static Map<String, Object> chatPayload(NotificationMessage message) {
        return Map.of("content", message.toText());
    }

    static Map<String, Object> pagingPayload(NotificationMessage message, NotificationDestination destination) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("incidentId", message.getIncidentId());
        details.put("link", message.getLink());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("summary", "[" + message.getSeverity() + "] " + message.getTitle());
        payload.put("source", SOURCE);
        payload.put("severity", pagingSeverity(message));
        payload.put("custom_details", details);

        Map<String, Object> event = new LinkedHashMap<>();
        event.put("routing_key", destination.getRoutingKey());
        event.put("event_action", "trigger");
        event.put("dedup_key", message.getIncidentId());
        event.put("payload", payload);
        event.put("links", List.of(Map.of("href", message.getLink(), "text", "Open incident")));
        return event;
    }

    static String pagingSeverity(NotificationMessage message) {
        return switch (message.getSeverity()) {
            case SEV1 -> "critical";
            case SEV2 -> "error";
            case SEV3 -> "warning";
            case SEV4 -> "info";
        };
    }
}
