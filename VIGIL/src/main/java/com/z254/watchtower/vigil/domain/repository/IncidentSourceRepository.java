package com.z254.watchtower.vigil.domain.repository;

import com.z254.watchtower.vigil.domain.model.IncidentSource;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface IncidentSourceRepository extends JpaRepository<IncidentSource, Long> {

    Optional<IncidentSource> findByIntegrationAndExternalId(String integration, String externalId);

    @Modifying
    @Query("DELETE FROM IncidentSource s WHERE s.incidentId = :incidentId")
    int deleteAllByIncidentId(@Param("incidentId") String incidentId);
}
