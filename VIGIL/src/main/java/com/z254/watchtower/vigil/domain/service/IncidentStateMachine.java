package com.z254.watchtower.vigil.domain.service;

import com.z254.watchtower.vigil.audit.AuditHashService;
import com.z254.watchtower.vigil.domain.exception.ConcurrentIncidentUpdateException;
import com.z254.watchtower.vigil.domain.exception.ForbiddenOperationException;
import com.z254.watchtower.vigil.domain.exception.IncidentNotFoundException;
import com.z254.watchtower.vigil.domain.exception.InvalidTransitionException;
import com.z254.watchtower.vigil.domain.exception.RequestValidationException;
import com.z254.watchtower.vigil.domain.model.*;
import com.z254.watchtower.vigil.domain.repository.IncidentCommentRepository;
import com.z254.watchtower.vigil.domain.repository.IncidentRepository;
import com.z254.watchtower.vigil.domain.repository.IncidentSourceRepository;
import com.z254.watchtower.vigil.notification.IncidentCreatedEvent;
import com.z254.watchtower.vigil.observability.VigilMetrics;
import com.z254.watchtower.vigil.observability.VigilStructuredLogger;
import com.z254.watchtower.vigil.observability.VigilStructuredLogger.IncidentEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.*;

/**
 * All writes to incidents go through here.
 * <p>
 * Every public mutation runs in one transaction: the incident row, its timeline events,
 * comments and subscriptions either all commit or none do. A notification for high-severity
 * incidents is published as an application event and only delivered after commit.
 */
@Slf4j
@Service
public class IncidentStateMachine {

    static final String CREATED_MESSAGE = "Incident created";

    private final IncidentRepository incidentRepository;
    private final IncidentCommentRepository commentRepository;
    private final IncidentSourceRepository sourceRepository;
    private final TimelineRecorder timelineRecorder;
    private final SubscriptionService subscriptionService;
    private final DirectoryLabels directory;
    private final AuditHashService auditHashService;
    private final ApplicationEventPublisher eventPublisher;
    private final VigilMetrics metrics;
    private final VigilStructuredLogger structuredLogger;
    private final Clock clock;

    public IncidentStateMachine(IncidentRepository incidentRepository,
                                IncidentCommentRepository commentRepository,
                                IncidentSourceRepository sourceRepository,
                                TimelineRecorder timelineRecorder,
                                SubscriptionService subscriptionService,
                                DirectoryLabels directory,
                                AuditHashService auditHashService,
                                ApplicationEventPublisher eventPublisher,
                                VigilMetrics metrics,
                                VigilStructuredLogger structuredLogger,
                                Clock clock) {
        this.incidentRepository = incidentRepository;
        this.commentRepository = commentRepository;
        this.sourceRepository = sourceRepository;
        this.timelineRecorder = timelineRecorder;
        this.subscriptionService = subscriptionService;
        this.directory = directory;
        this.auditHashService = auditHashService;
        this.eventPublisher = eventPublisher;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
    }

    /**
     * Open a new incident. The status is always NEW; severity defaults to SEV3.
     */
    @Transactional
    public Incident createIncident(IncidentDraft draft, String reporterId) {
        requireActor(reporterId);
        String title = requireText(draft.getTitle(), "title");
        String description = requireText(draft.getDescription(), "description");
        Severity severity = draft.getSeverity() != null ? draft.getSeverity() : Severity.DEFAULT;
        String teamId = directory.requireTeam(blankToNull(draft.getTeamId()));
        String assigneeId = directory.requireUser(blankToNull(draft.getAssigneeId()));
        Optional<CatalogService> service = directory.resolveService(draft.getPrimaryServiceId(), draft.getPrimaryServiceKey());
        Set<String> categoryIds = directory.requireCategories(draft.getCategoryIds());
        Set<String> tagIds = directory.requireTags(draft.getTagIds());

        Instant now = now();
        Incident incident = incidentRepository.save(Incident.builder()
                .id(UUID.randomUUID().toString())
                .title(title)
                .description(description)
                .status(IncidentStatus.NEW)
                .severity(severity)
                .createdAt(now)
                .updatedAt(now)
                .reporterId(reporterId)
                .assigneeId(assigneeId)
                .teamId(teamId)
                .primaryServiceId(service.map(CatalogService::getId).orElse(null))
                .categoryIds(new LinkedHashSet<>(categoryIds))
                .tagIds(new LinkedHashSet<>(tagIds))
                .build());

        timelineRecorder.recordStatusChange(incident.getId(), null, IncidentStatus.NEW, CREATED_MESSAGE, reporterId, now);
        subscriptionService.ensureSubscribed(incident.getId(), reporterId, now);
        subscriptionService.ensureSubscribed(incident.getId(), assigneeId, now);
        service.ifPresent(s -> timelineRecorder.recordFieldUpdate(
                incident.getId(), "Service set: " + s.displayLabel(), reporterId, now));

        auditHashService.refresh(incident);

        eventPublisher.publishEvent(new IncidentCreatedEvent(
                incident.getId(), incident.getTitle(), severity, reporterId, now));

        metrics.recordIncidentCreated(severity);
        structuredLogger.logIncidentEvent(incident.getId(), reporterId, IncidentEventType.CREATED,
                "Incident created", Map.of("severity", severity.name()));
        return incident;
    }

    /**
     * Move an incident to {@code newStatus}.
     *
     * @throws IncidentNotFoundException  when the incident does not exist
     * @throws InvalidTransitionException when the transition table does not allow the move
     */
    @Transactional
    public Incident changeStatus(String incidentId, IncidentStatus newStatus, String message, String actorId) {
        requireActor(actorId);
        if (newStatus == null) {
            throw new RequestValidationException("status is required");
        }
        Incident incident = load(incidentId);
        IncidentStatus current = incident.getStatus();

        if (!IncidentTransitions.isAllowed(current, newStatus)) {
            metrics.getTransitionsRejected().increment();
            structuredLogger.logIncidentEvent(incidentId, actorId, IncidentEventType.TRANSITION_REJECTED,
                    "Transition rejected", Map.of("from", current.name(), "to", newStatus.name()));
            throw new InvalidTransitionException(current, newStatus);
        }

        Instant now = now();
        incident.setStatus(newStatus);
        incident.markMilestone(newStatus, now);
        incident.setUpdatedAt(now);
        timelineRecorder.recordStatusChange(incidentId, current, newStatus, message, actorId, now);

        Incident saved = flush(incident);
        metrics.recordTransition(newStatus);
        structuredLogger.logIncidentEvent(incidentId, actorId, IncidentEventType.STATUS_CHANGED,
                "Status changed", Map.of("from", current.name(), "to", newStatus.name()));
        return saved;
    }

    /**
     * Apply a partial update. Each field that actually changes gets its own timeline entry;
     * assignee changes are recorded as ASSIGNMENT, everything else as FIELD_UPDATE.
     */
    @Transactional
    public Incident updateFields(String incidentId, IncidentUpdate changes, String actorId) {
        requireActor(actorId);
        if (changes == null || changes.isEmpty()) {
            throw new RequestValidationException("At least one field must be provided");
        }
        Incident incident = load(incidentId);
        Instant now = now();
        List<String> changed = new ArrayList<>();

        if (changes.getTitle() != null) {
            String title = requireText(changes.getTitle(), "title");
            if (!title.equals(incident.getTitle())) {
                incident.setTitle(title);
                timelineRecorder.recordFieldUpdate(incidentId, "Title updated", actorId, now);
                changed.add("title");
            }
        }

        if (changes.getDescription() != null) {
            String description = requireText(changes.getDescription(), "description");
            if (!description.equals(incident.getDescription())) {
                incident.setDescription(description);
                timelineRecorder.recordFieldUpdate(incidentId, "Description updated", actorId, now);
                changed.add("description");
            }
        }

        if (changes.getSeverity() != null && changes.getSeverity() != incident.getSeverity()) {
            Severity previous = incident.getSeverity();
            incident.setSeverity(changes.getSeverity());
            timelineRecorder.recordFieldUpdate(incidentId,
                    "Severity updated: " + previous + " → " + changes.getSeverity(), actorId, now);
            changed.add("severity");
        }

        if (changes.getTeamId() != null) {
            String teamId = directory.requireTeam(blankToNull(changes.getTeamId()));
            if (!Objects.equals(teamId, incident.getTeamId())) {
                String previous = incident.getTeamId();
                incident.setTeamId(teamId);
                timelineRecorder.recordFieldUpdate(incidentId,
                        "Team updated: " + labelOrNone(directory.teamLabel(previous))
                                + " → " + labelOrNone(directory.teamLabel(teamId)),
                        actorId, now);
                changed.add("team");
            }
        }

        if (changes.getPrimaryServiceId() != null || changes.getPrimaryServiceKey() != null) {
            Optional<CatalogService> service = directory.resolveService(changes.getPrimaryServiceId(), changes.getPrimaryServiceKey());
            String serviceId = service.map(CatalogService::getId).orElse(null);
            if (!Objects.equals(serviceId, incident.getPrimaryServiceId())) {
                incident.setPrimaryServiceId(serviceId);
                timelineRecorder.recordFieldUpdate(incidentId,
                        service.map(s -> "Service updated: " + s.displayLabel()).orElse("Service removed"),
                        actorId, now);
                changed.add("service");
            }
        }

        if (changes.getCategoryIds() != null) {
            Set<String> categoryIds = directory.requireCategories(changes.getCategoryIds());
            if (!categoryIds.equals(incident.getCategoryIds())) {
                incident.getCategoryIds().clear();
                incident.getCategoryIds().addAll(categoryIds);
                timelineRecorder.recordFieldUpdate(incidentId,
                        "Categories updated: " + joinLabels(directory.categoryLabels(categoryIds), categoryIds),
                        actorId, now);
                changed.add("categories");
            }
        }

        if (changes.getTagIds() != null) {
            Set<String> tagIds = directory.requireTags(changes.getTagIds());
            if (!tagIds.equals(incident.getTagIds())) {
                incident.getTagIds().clear();
                incident.getTagIds().addAll(tagIds);
                timelineRecorder.recordFieldUpdate(incidentId,
                        "Tags updated: " + joinLabels(directory.tagLabels(tagIds), tagIds),
                        actorId, now);
                changed.add("tags");
            }
        }

        if (changes.getAssigneeId() != null) {
            String assigneeId = directory.requireUser(blankToNull(changes.getAssigneeId()));
            if (!Objects.equals(assigneeId, incident.getAssigneeId())) {
                incident.setAssigneeId(assigneeId);
                timelineRecorder.recordAssignment(incidentId,
                        assigneeId == null ? "Assignee removed" : "Assignee updated: " + directory.userLabel(assigneeId),
                        actorId, now);
                subscriptionService.ensureSubscribed(incidentId, assigneeId, now);
                changed.add("assignee");
            }
        }

        if (changed.isEmpty()) {
            return incident;
        }
        incident.setUpdatedAt(now);
        Incident saved = flush(incident);
        structuredLogger.logIncidentEvent(incidentId, actorId, IncidentEventType.FIELDS_UPDATED,
                "Incident fields updated", Map.of("fields", String.join(",", changed)));
        return saved;
    }

    /**
     * Store a comment and its COMMENT timeline entry together.
     */
    @Transactional
    public IncidentComment addComment(String incidentId, String body, String actorId) {
        requireActor(actorId);
        String text = requireText(body, "body");
        Incident incident = load(incidentId);
        Instant now = now();

        IncidentComment comment = commentRepository.save(IncidentComment.builder()
                .id(UUID.randomUUID().toString())
                .incidentId(incidentId)
                .authorId(actorId)
                .body(text)
                .createdAt(now)
                .build());
        timelineRecorder.recordComment(incidentId, text, actorId, now);

        incident.setUpdatedAt(now);
        flush(incident);
        metrics.getCommentsAdded().increment();
        structuredLogger.logIncidentEvent(incidentId, actorId, IncidentEventType.COMMENTED, "Comment added");
        return comment;
    }

    /**
     * Hard-delete an incident together with its timeline, comments, subscriptions and alert sources.
     *
     * @throws ForbiddenOperationException unless {@code actorId} reported the incident
     */
    @Transactional
    public void deleteIncident(String incidentId, String actorId) {
        requireActor(actorId);
        Incident incident = load(incidentId);
        if (!incident.isReportedBy(actorId)) {
            structuredLogger.logIncidentEvent(incidentId, actorId, IncidentEventType.DELETE_REFUSED,
                    "Delete refused for non-reporter");
            throw new ForbiddenOperationException("Only the reporter can delete incident " + incidentId);
        }

        int events = timelineRecorder.purge(incidentId);
        int comments = commentRepository.deleteAllByIncidentId(incidentId);
        int subscriptions = subscriptionService.purge(incidentId);
        int sources = sourceRepository.deleteAllByIncidentId(incidentId);
        incidentRepository.delete(incident);

        metrics.getIncidentsDeleted().increment();
        structuredLogger.logIncidentEvent(incidentId, actorId, IncidentEventType.DELETED, "Incident deleted",
                Map.of("timelineEvents", events, "comments", comments, "subscriptions", subscriptions,
                        "sources", sources));
    }

    /**
     * @return the resulting subscription state, always true
     */
    @Transactional
    public boolean subscribe(String incidentId, String userId) {
        requireActor(userId);
        load(incidentId);
        subscriptionService.ensureSubscribed(incidentId, userId, now());
        return true;
    }

    /**
     * @return the resulting subscription state, always false
     */
    @Transactional
    public boolean unsubscribe(String incidentId, String userId) {
        requireActor(userId);
        load(incidentId);
        subscriptionService.unsubscribe(incidentId, userId);
        return false;
    }

    // ========== Helpers ==========

    private Incident load(String incidentId) {
        return incidentRepository.findById(incidentId)
                .orElseThrow(() -> new IncidentNotFoundException(incidentId));
    }

    /**
     * Refresh the audit hash and write the incident now, so that a stale version surfaces here.
     */
    private Incident flush(Incident incident) {
        auditHashService.refresh(incident);
        try {
            return incidentRepository.saveAndFlush(incident);
        } catch (OptimisticLockingFailureException e) {
            metrics.getConcurrentUpdateConflicts().increment();
            structuredLogger.logIncidentEvent(incident.getId(), null, IncidentEventType.CONFLICT,
                    "Concurrent update detected");
            throw new ConcurrentIncidentUpdateException(incident.getId(), e);
        }
    }

    private Instant now() {
        return Instant.now(clock).truncatedTo(ChronoUnit.MILLIS);
    }

    private static void requireActor(String actorId) {
        if (actorId == null || actorId.isBlank()) {
            throw new RequestValidationException("Acting user id is required");
        }
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new RequestValidationException(field + " must not be blank");
        }
        return value.trim();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static String labelOrNone(String label) {
        return label == null ? "none" : label;
    }

    private static String joinLabels(Map<String, String> labels, Collection<String> ids) {
        if (ids.isEmpty()) {
            return "none";
        }
        return ids.stream().map(id -> labels.getOrDefault(id, id)).sorted().reduce((a, b) -> a + ", " + b).orElse("none");
    }
}
