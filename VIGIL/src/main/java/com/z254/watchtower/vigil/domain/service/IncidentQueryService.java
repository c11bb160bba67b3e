package com.z254.watchtower.vigil.domain.service;

import com.z254.watchtower.vigil.domain.exception.IncidentNotFoundException;
import com.z254.watchtower.vigil.domain.exception.RequestValidationException;
import com.z254.watchtower.vigil.domain.model.Incident;
import com.z254.watchtower.vigil.domain.model.IncidentComment;
import com.z254.watchtower.vigil.domain.model.IncidentQuery;
import com.z254.watchtower.vigil.domain.model.TimelineEvent;
import com.z254.watchtower.vigil.domain.repository.IncidentCommentRepository;
import com.z254.watchtower.vigil.domain.repository.IncidentRepository;
import com.z254.watchtower.vigil.domain.repository.IncidentSpecifications;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Read side of the incident lifecycle.
 */
@Service
@Transactional(readOnly = true)
public class IncidentQueryService {

    public static final int MAX_PAGE_SIZE = 200;

    private final IncidentRepository incidentRepository;
    private final IncidentCommentRepository commentRepository;
    private final TimelineRecorder timelineRecorder;
    private final DirectoryLabels directory;

    public IncidentQueryService(IncidentRepository incidentRepository,
                                IncidentCommentRepository commentRepository,
                                TimelineRecorder timelineRecorder,
                                DirectoryLabels directory) {
        this.incidentRepository = incidentRepository;
        this.commentRepository = commentRepository;
        this.timelineRecorder = timelineRecorder;
        this.directory = directory;
    }

    public Incident getIncident(String incidentId) {
        return incidentRepository.findById(incidentId)
                .orElseThrow(() -> new IncidentNotFoundException(incidentId));
    }

    /**
     * Incidents matching {@code query}, newest first.
     */
    public Page<Incident> listIncidents(IncidentQuery query, int page, int size) {
        if (page < 0 || size < 1 || size > MAX_PAGE_SIZE) {
            throw new RequestValidationException("page must be >= 0 and size between 1 and " + MAX_PAGE_SIZE);
        }
        if (query.getCreatedFrom() != null && query.getCreatedTo() != null
                && !query.getCreatedFrom().isBefore(query.getCreatedTo())) {
            throw new RequestValidationException("createdFrom must be before createdTo");
        }
        String serviceId = query.getPrimaryServiceId();
        if (serviceId == null && query.getPrimaryServiceKey() != null) {
            // an unknown key matches nothing rather than everything
            serviceId = directory.findServiceIdByKey(query.getPrimaryServiceKey()).orElse("");
        }
        return incidentRepository.findAll(
                IncidentSpecifications.forQuery(query, serviceId),
                PageRequest.of(page, size, Sort.by(Sort.Order.desc("createdAt"), Sort.Order.asc("id"))));
    }

    public List<TimelineEvent> listTimeline(String incidentId) {
        requireExists(incidentId);
        return timelineRecorder.history(incidentId);
    }

    public List<IncidentComment> listComments(String incidentId) {
        requireExists(incidentId);
        return commentRepository.findByIncidentIdOrderByCreatedAtAscIdAsc(incidentId);
    }

    private void requireExists(String incidentId) {
        if (!incidentRepository.existsById(incidentId)) {
            throw new IncidentNotFoundException(incidentId);
        }
    }
}
