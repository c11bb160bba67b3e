package com.z254.watchtower.vigil.domain.service;

import com.z254.watchtower.vigil.domain.model.NotificationSubscription;
import com.z254.watchtower.vigil.domain.repository.NotificationSubscriptionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Keeps track of who follows an incident. Subscribing twice is a no-op.
 */
@Slf4j
@Service
public class SubscriptionService {

    private final NotificationSubscriptionRepository subscriptionRepository;

    public SubscriptionService(NotificationSubscriptionRepository subscriptionRepository) {
        this.subscriptionRepository = subscriptionRepository;
    }

    /**
     * @return true if a new subscription was created
     */
    public boolean ensureSubscribed(String incidentId, String userId, Instant at) {
        if (userId == null || subscriptionRepository.existsByIncidentIdAndUserId(incidentId, userId)) {
            return false;
        }
        subscriptionRepository.save(NotificationSubscription.builder()
                .incidentId(incidentId)
                .userId(userId)
                .createdAt(at)
                .build());
        log.debug("User {} subscribed to incident {}", userId, incidentId);
        return true;
    }

    /**
     * @return true if a subscription existed and was removed
     */
    public boolean unsubscribe(String incidentId, String userId) {
        return subscriptionRepository.deleteByIncidentIdAndUserId(incidentId, userId) > 0;
    }

    public boolean isSubscribed(String incidentId, String userId) {
        return subscriptionRepository.existsByIncidentIdAndUserId(incidentId, userId);
    }

    public List<String> subscribers(String incidentId) {
        return subscriptionRepository.findByIncidentId(incidentId).stream()
                .map(NotificationSubscription::getUserId)
                .toList();
    }

    public int purge(String incidentId) {
        return subscriptionRepository.deleteAllByIncidentId(incidentId);
    }
}
