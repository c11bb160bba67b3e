package com.z254.watchtower.vigil.reports;

import com.z254.watchtower.vigil.domain.model.Incident;
import com.z254.watchtower.vigil.domain.repository.IncidentRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Loads the incidents a report runs over. All report types share this so that one filter
 * always selects the same population.
 */
@Component
public class ReportScope {

    private static final Sort OLDEST_FIRST = Sort.by(Sort.Order.asc("createdAt"), Sort.Order.asc("id"));
    private static final Sort NEWEST_FIRST = Sort.by(Sort.Order.desc("createdAt"), Sort.Order.asc("id"));

    private final IncidentRepository incidentRepository;

    public ReportScope(IncidentRepository incidentRepository) {
        this.incidentRepository = incidentRepository;
    }

    public List<Incident> incidents(ReportFilter filter) {
        return incidentRepository.findAll(filter.toSpecification(), OLDEST_FIRST);
    }

    public List<Incident> newest(ReportFilter filter, int limit) {
        return incidentRepository.findAll(filter.toSpecification(), PageRequest.of(0, limit, NEWEST_FIRST))
                .getContent();
    }
}
