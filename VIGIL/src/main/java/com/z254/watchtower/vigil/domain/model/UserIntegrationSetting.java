package com.z254.watchtower.vigil.domain.model;

import com.z254.watchtower.vigil.notification.ChannelKind;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * A user's opt-in or opt-out for one kind of notification channel. No row means enabled.
 */
@Entity
@Table(name = "user_integration_settings", uniqueConstraints = {
        @UniqueConstraint(name = "uk_integration_setting_user_kind", columnNames = {"user_id", "kind"})
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserIntegrationSetting {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, updatable = false, length = 36)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, updatable = false, length = 20)
    private ChannelKind kind;

    @Column(name = "notifications_enabled", nullable = false)
    private boolean notificationsEnabled;

    /** Last explicit save, null for a default that was never stored */
    @Column(name = "last_saved_at")
    private Instant lastSavedAt;
}
