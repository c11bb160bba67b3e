package com.z254.watchtower.vigil.domain.repository;

import com.z254.watchtower.vigil.domain.model.IncidentComment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface IncidentCommentRepository extends JpaRepository<IncidentComment, String> {

    List<IncidentComment> findByIncidentIdOrderByCreatedAtAscIdAsc(String incidentId);

    @Modifying
    @Query("DELETE FROM IncidentComment c WHERE c.incidentId = :incidentId")
    int deleteAllByIncidentId(@Param("incidentId") String incidentId);
}
