package com.z254.watchtower.vigil.api.v1;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.watchtower.vigil.config.VigilProperties;
import com.z254.watchtower.vigil.domain.exception.WebhookAuthenticationException;
import com.z254.watchtower.vigil.ingestion.AlertIngestionResult;
import com.z254.watchtower.vigil.ingestion.AlertIngestionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Receives alerts pushed by the monitoring system.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/webhooks/alerts")
@Tag(name = "Webhooks", description = "Inbound monitoring alerts")
public class AlertWebhookController {

    private final AlertIngestionService ingestionService;
    private final VigilProperties properties;

    public AlertWebhookController(AlertIngestionService ingestionService, VigilProperties properties) {
        this.ingestionService = ingestionService;
        this.properties = properties;
    }

    @PostMapping
    @Operation(summary = "Ingest alert",
            description = "Open an incident for a new alert (201) or comment on the incident of a known one (200)")
    public Mono<ResponseEntity<AlertIngestionResult>> ingest(
            @Parameter(description = "Shared webhook secret, required when one is configured")
            @RequestHeader(value = ApiHeaders.WEBHOOK_TOKEN, required = false) String token,
            @RequestBody JsonNode payload) {

        return Mono.fromCallable(() -> {
                    authenticate(token);
                    AlertIngestionResult result = ingestionService.ingest(payload);
                    return ResponseEntity.status(result.created() ? HttpStatus.CREATED : HttpStatus.OK).body(result);
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    private void authenticate(String token) {
        VigilProperties.Ingestion config = properties.getIngestion();
        if (!config.isTokenRequired()) {
            return;
        }
        byte[] expected = config.getWebhookToken().getBytes(StandardCharsets.UTF_8);
        byte[] presented = token == null ? new byte[0] : token.getBytes(StandardCharsets.UTF_8);
        if (!MessageDigest.isEqual(expected, presented)) {
            throw new WebhookAuthenticationException("Missing or invalid webhook token");
        }
    }
}
