package com.z254.watchtower.vigil.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * A user following an incident.
 */
@Entity
@Table(name = "incident_subscriptions", uniqueConstraints = {
        @UniqueConstraint(name = "uk_subscription_incident_user", columnNames = {"incident_id", "user_id"})
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationSubscription {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "incident_id", nullable = false, updatable = false, length = 36)
    private String incidentId;

    @Column(name = "user_id", nullable = false, updatable = false, length = 36)
    private String userId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
