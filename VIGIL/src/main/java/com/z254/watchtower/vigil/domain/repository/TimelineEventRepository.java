package com.z254.watchtower.vigil.domain.repository;

import com.z254.watchtower.vigil.domain.model.TimelineEvent;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

import java.util.List;

/**
 * Append-only store for timeline events.
 * <p>
 * Extends the bare {@link Repository} marker so that no per-event update or
 * delete method exists. The only removal path is {@link #purgeByIncidentId(String)}, used when
 * the owning incident itself is deleted.
 */
@org.springframework.stereotype.Repository
public interface TimelineEventRepository extends Repository<TimelineEvent, Long> {

    TimelineEvent save(TimelineEvent event);

    List<TimelineEvent> findByIncidentIdOrderByCreatedAtAscIdAsc(String incidentId);

    @Modifying
    @Query("DELETE FROM TimelineEvent e WHERE e.incidentId = :incidentId")
    int purgeByIncidentId(@Param("incidentId") String incidentId);
}
