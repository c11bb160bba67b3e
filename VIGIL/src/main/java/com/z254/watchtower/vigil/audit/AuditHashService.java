package com.z254.watchtower.vigil.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.z254.watchtower.vigil.config.VigilProperties;
import com.z254.watchtower.vigil.domain.exception.AuditIntegrityException;
import com.z254.watchtower.vigil.domain.model.Incident;
import com.z254.watchtower.vigil.domain.model.IncidentComment;
import com.z254.watchtower.vigil.domain.model.TimelineEvent;
import com.z254.watchtower.vigil.domain.repository.IncidentCommentRepository;
import com.z254.watchtower.vigil.domain.repository.TimelineEventRepository;
import com.z254.watchtower.vigil.observability.VigilStructuredLogger;
import com.z254.watchtower.vigil.observability.VigilStructuredLogger.IncidentEventType;
import org.springframework.stereotype.Service;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.*;

/**
 * Tamper evidence for incidents.
 * <p>
 * Signs a canonical JSON rendering of the incident, its timeline and its comments with
 * HMAC-SHA256. The hash is refreshed inside every lifecycle transaction and checked before an
 * incident document is exported, so only out-of-band edits to the store cause a mismatch.
 * Everything is a no-op while {@code vigil.audit.hmac-secret} is unset.
 */
@Service
public class AuditHashService {

    private static final String ALGORITHM = "HmacSHA256";

    private final VigilProperties properties;
    private final TimelineEventRepository timelineEventRepository;
    private final IncidentCommentRepository commentRepository;
    private final VigilStructuredLogger structuredLogger;
    private final Clock clock;
    private final ObjectMapper canonicalMapper;

    public AuditHashService(VigilProperties properties,
                            TimelineEventRepository timelineEventRepository,
                            IncidentCommentRepository commentRepository,
                            VigilStructuredLogger structuredLogger,
                            Clock clock) {
        this.properties = properties;
        this.timelineEventRepository = timelineEventRepository;
        this.commentRepository = commentRepository;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
        this.canonicalMapper = new ObjectMapper()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    public boolean isEnabled() {
        return properties.getAudit().isEnabled();
    }

    /**
     * Recompute and store the hash on the (managed) incident.
     */
    public void refresh(Incident incident) {
        if (!isEnabled()) {
            return;
        }
        incident.setAuditHash(compute(incident));
        incident.setAuditHashUpdatedAt(Instant.now(clock).truncatedTo(ChronoUnit.MILLIS));
    }

    /**
     * Check the stored hash. An incident that was never hashed is hashed now.
     *
     * @throws AuditIntegrityException when the stored hash does not match the current data
     */
    public void verify(Incident incident) {
        if (!isEnabled()) {
            return;
        }
        if (incident.getAuditHash() == null) {
            refresh(incident);
            return;
        }
        String expected = compute(incident);
        boolean matches = MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.US_ASCII),
                incident.getAuditHash().getBytes(StandardCharsets.US_ASCII));
        if (!matches) {
            structuredLogger.logIncidentEvent(incident.getId(), null, IncidentEventType.AUDIT_MISMATCH,
                    "Audit hash mismatch");
            throw new AuditIntegrityException(incident.getId());
        }
    }

    String compute(Incident incident) {
        return hmacHex(canonicalPayload(incident));
    }

    String canonicalPayload(Incident incident) {
        Map<String, Object> root = new TreeMap<>();
        root.put("id", incident.getId());
        root.put("title", incident.getTitle());
        root.put("description", incident.getDescription());
        root.put("status", incident.getStatus().name());
        root.put("severity", incident.getSeverity().name());
        root.put("reporterId", incident.getReporterId());
        root.put("assigneeId", incident.getAssigneeId());
        root.put("teamId", incident.getTeamId());
        root.put("primaryServiceId", incident.getPrimaryServiceId());
        root.put("createdAt", iso(incident.getCreatedAt()));
        root.put("triagedAt", iso(incident.getTriagedAt()));
        root.put("inProgressAt", iso(incident.getInProgressAt()));
        root.put("resolvedAt", iso(incident.getResolvedAt()));
        root.put("closedAt", iso(incident.getClosedAt()));
        root.put("categoryIds", new TreeSet<>(incident.getCategoryIds()));
        root.put("tagIds", new TreeSet<>(incident.getTagIds()));

        List<Map<String, Object>> timeline = new ArrayList<>();
        for (TimelineEvent event : timelineEventRepository.findByIncidentIdOrderByCreatedAtAscIdAsc(incident.getId())) {
            Map<String, Object> entry = new TreeMap<>();
            entry.put("id", event.getId());
            entry.put("type", event.getType().name());
            entry.put("fromStatus", event.getFromStatus() == null ? null : event.getFromStatus().name());
            entry.put("toStatus", event.getToStatus() == null ? null : event.getToStatus().name());
            entry.put("message", event.getMessage());
            entry.put("authorId", event.getAuthorId());
            entry.put("createdAt", iso(event.getCreatedAt()));
            timeline.add(entry);
        }
        root.put("timeline", timeline);

        List<Map<String, Object>> comments = new ArrayList<>();
        for (IncidentComment comment : commentRepository.findByIncidentIdOrderByCreatedAtAscIdAsc(incident.getId())) {
            Map<String, Object> entry = new TreeMap<>();
            entry.put("id", comment.getId());
            entry.put("authorId", comment.getAuthorId());
            entry.put("body", comment.getBody());
            entry.put("createdAt", iso(comment.getCreatedAt()));
            comments.add(entry);
        }
        root.put("comments", comments);

        try {
            return canonicalMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize audit payload for incident " + incident.getId(), e);
        }
    }

    private String hmacHex(String payload) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(properties.getAudit().getHmacSecret().getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }

    private static String iso(Instant instant) {
        return instant == null ? null : instant.truncatedTo(ChronoUnit.MILLIS).toString();
    }
}
