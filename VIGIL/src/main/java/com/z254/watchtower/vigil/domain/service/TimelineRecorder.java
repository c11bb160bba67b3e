package com.z254.watchtower.vigil.domain.service;

import com.z254.watchtower.vigil.domain.model.IncidentStatus;
import com.z254.watchtower.vigil.domain.model.TimelineEvent;
import com.z254.watchtower.vigil.domain.model.TimelineEventType;
import com.z254.watchtower.vigil.domain.repository.TimelineEventRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Writes and reads the append-only incident timeline.
 * <p>
 * Callers pass the timestamp so that an event and the incident change it describes share
 * the same instant. Appends join the caller's transaction.
 */
@Slf4j
@Component
public class TimelineRecorder {

    static final String DEFAULT_STATUS_MESSAGE = "Status changed to %s";

    private final TimelineEventRepository timelineEventRepository;

    public TimelineRecorder(TimelineEventRepository timelineEventRepository) {
        this.timelineEventRepository = timelineEventRepository;
    }

    /**
     * Append a STATUS_CHANGE event. A blank message is replaced with {@code Status changed to <STATUS>}.
     */
    public TimelineEvent recordStatusChange(String incidentId, IncidentStatus from, IncidentStatus to,
                                            String message, String authorId, Instant at) {
        String effectiveMessage = message == null || message.isBlank()
                ? String.format(DEFAULT_STATUS_MESSAGE, to)
                : message;
        return append(TimelineEvent.builder()
                .incidentId(incidentId)
                .type(TimelineEventType.STATUS_CHANGE)
                .fromStatus(from)
                .toStatus(to)
                .message(effectiveMessage)
                .authorId(authorId)
                .createdAt(at)
                .build());
    }

    public TimelineEvent recordComment(String incidentId, String body, String authorId, Instant at) {
        return append(simple(incidentId, TimelineEventType.COMMENT, body, authorId, at));
    }

    public TimelineEvent recordFieldUpdate(String incidentId, String message, String authorId, Instant at) {
        return append(simple(incidentId, TimelineEventType.FIELD_UPDATE, message, authorId, at));
    }

    public TimelineEvent recordAssignment(String incidentId, String message, String authorId, Instant at) {
        return append(simple(incidentId, TimelineEventType.ASSIGNMENT, message, authorId, at));
    }

    /**
     * Events of an incident, oldest first.
     */
    public List<TimelineEvent> history(String incidentId) {
        return timelineEventRepository.findByIncidentIdOrderByCreatedAtAscIdAsc(incidentId);
    }

    /**
     * Remove the whole timeline of an incident that is being deleted.
     */
    public int purge(String incidentId) {
        int removed = timelineEventRepository.purgeByIncidentId(incidentId);
        log.debug("Purged {} timeline events of incident {}", removed, incidentId);
        return removed;
    }

    private TimelineEvent simple(String incidentId, TimelineEventType type, String message,
                                 String authorId, Instant at) {
        return TimelineEvent.builder()
                .incidentId(incidentId)
                .type(type)
                .message(message)
                .authorId(authorId)
                .createdAt(at)
                .build();
    }

    private TimelineEvent append(TimelineEvent event) {
        TimelineEvent saved = timelineEventRepository.save(event);
        log.debug("Appended {} event to incident {}", saved.getType(), saved.getIncidentId());
        return saved;
    }
}
