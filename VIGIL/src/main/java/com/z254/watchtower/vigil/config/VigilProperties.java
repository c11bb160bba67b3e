package com.z254.watchtower.vigil.config;

import com.z254.watchtower.vigil.domain.model.Severity;
import com.z254.watchtower.vigil.notification.ChannelKind;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the VIGIL service.
 * <p>
 * Provides centralized configuration for:
 * <ul>
 *     <li>SLA resolution targets per severity</li>
 *     <li>Notification channels and deep-link base URL</li>
 *     <li>Report export limits</li>
 *     <li>Audit hash secret</li>
 *     <li>Monitoring alert ingestion</li>
 * </ul>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "vigil")
public class VigilProperties {

    @Valid
    private final Sla sla = new Sla();
    @Valid
    private final Notifications notifications = new Notifications();
    @Valid
    private final Reports reports = new Reports();
    private final Audit audit = new Audit();
    @Valid
    private final Ingestion ingestion = new Ingestion();

    /**
     * Time-to-resolve targets. Severities missing from the map fall back to the built-in defaults.
     */
    @Data
    public static class Sla {
        private Map<Severity, Duration> targets = defaultTargets();

        public static Map<Severity, Duration> defaultTargets() {
            Map<Severity, Duration> defaults = new EnumMap<>(Severity.class);
            defaults.put(Severity.SEV1, Duration.ofMinutes(45));
            defaults.put(Severity.SEV2, Duration.ofHours(2));
            defaults.put(Severity.SEV3, Duration.ofHours(8));
            defaults.put(Severity.SEV4, Duration.ofHours(24));
            return defaults;
        }
    }

    /**
     * Outbound notification settings.
     */
    @Data
    public static class Notifications {
        /** Base URL of the web front end, used to build incident deep links */
        @NotBlank
        private String publicBaseUrl = "http://localhost:3000";

        /** Per-call timeout towards a destination */
        private Duration timeout = Duration.ofSeconds(5);

        @Valid
        private List<Channel> channels = new ArrayList<>();

        @Data
        public static class Channel {
            @NotBlank
            private String name;
            @NotNull
            private ChannelKind kind;
            @NotBlank
            private String url;
            /** Integration key for paging destinations */
            private String routingKey;
            private boolean enabled = true;
        }
    }

    /**
     * Report generation limits.
     */
    @Data
    public static class Reports {
        @Positive
        private int exportDefaultLimit = 5000;

        @Positive
        @Max(100_000)
        private int exportMaxLimit = 10_000;

        /** Rows listed in a rendered report document */
        @Positive
        private int documentMaxRows = 200;

        @Positive
        private int maxTimeseriesBuckets = 3700;
    }

    /**
     * Incident audit hashing. Disabled while no secret is configured.
     */
    @Data
    public static class Audit {
        private String hmacSecret;

        public boolean isEnabled() {
            return hmacSecret != null && !hmacSecret.isBlank();
        }
    }

    /**
     * Inbound alert webhook.
     */
    @Data
    public static class Ingestion {
        /** Name the alert ids are scoped to */
        @NotBlank
        private String integration = "monitoring";

        /** User recorded as reporter and comment author for ingested alerts */
        @NotBlank
        private String reporterId = "alert-ingestion";

        /** Shared secret expected in the webhook token header; unchecked while blank */
        private String webhookToken;

        public boolean isTokenRequired() {
            return webhookToken != null && !webhookToken.isBlank();
        }
    }
}
