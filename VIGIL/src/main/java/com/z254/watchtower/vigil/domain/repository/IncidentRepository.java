package com.z254.watchtower.vigil.domain.repository;

import com.z254.watchtower.vigil.domain.model.Incident;
import com.z254.watchtower.vigil.domain.model.IncidentStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.util.Collection;

/**
 * Repository for incidents. Filtered reads go through {@link IncidentSpecifications}.
 */
@Repository
public interface IncidentRepository extends JpaRepository<Incident, String>, JpaSpecificationExecutor<Incident> {

    long countByStatusNotIn(Collection<IncidentStatus> statuses);
}
