package com.z254.watchtower.vigil.domain.repository;

import com.z254.watchtower.vigil.domain.model.NotificationSubscription;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface NotificationSubscriptionRepository extends JpaRepository<NotificationSubscription, Long> {

    boolean existsByIncidentIdAndUserId(String incidentId, String userId);

    List<NotificationSubscription> findByIncidentId(String incidentId);

    @Modifying
    @Query("DELETE FROM NotificationSubscription s WHERE s.incidentId = :incidentId AND s.userId = :userId")
    int deleteByIncidentIdAndUserId(@Param("incidentId") String incidentId, @Param("userId") String userId);

    @Modifying
    @Query("DELETE FROM NotificationSubscription s WHERE s.incidentId = :incidentId")
    int deleteAllByIncidentId(@Param("incidentId") String incidentId);
}
