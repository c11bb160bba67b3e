package com.z254.watchtower.vigil.notification;

import com.z254.watchtower.vigil.domain.exception.RequestValidationException;
import com.z254.watchtower.vigil.domain.model.UserIntegrationSetting;
import com.z254.watchtower.vigil.domain.repository.UserIntegrationSettingRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Per-user notification preferences, one switch per {@link ChannelKind}.
 * <p>
 * A kind the user never saved counts as enabled.
 */
@Slf4j
@Service
public class IntegrationSettingsService {

    private final UserIntegrationSettingRepository repository;
    private final Clock clock;

    public IntegrationSettingsService(UserIntegrationSettingRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * @return one setting per kind, in declaration order, defaults filled in
     */
    @Transactional(readOnly = true)
    public List<UserIntegrationSetting> getForUser(String userId) {
        requireUser(userId);
        Map<ChannelKind, UserIntegrationSetting> saved = new EnumMap<>(ChannelKind.class);
        repository.findByUserId(userId).forEach(setting -> saved.put(setting.getKind(), setting));

        List<UserIntegrationSetting> settings = new ArrayList<>(ChannelKind.values().length);
        for (ChannelKind kind : ChannelKind.values()) {
            settings.add(saved.getOrDefault(kind, UserIntegrationSetting.builder()
                    .userId(userId)
                    .kind(kind)
                    .notificationsEnabled(true)
                    .build()));
        }
        return settings;
    }

    @Transactional
    public List<UserIntegrationSetting> setEnabledForUser(String userId, ChannelKind kind, boolean enabled) {
        requireUser(userId);
        if (kind == null) {
            throw new RequestValidationException("kind is required");
        }
        Instant now = Instant.now(clock).truncatedTo(ChronoUnit.MILLIS);
        UserIntegrationSetting setting = repository.findByUserIdAndKind(userId, kind)
                .orElseGet(() -> UserIntegrationSetting.builder().userId(userId).kind(kind).build());
        setting.setNotificationsEnabled(enabled);
        setting.setLastSavedAt(now);
        repository.save(setting);
        log.info("User {} turned {} notifications {}", userId, kind.param(), enabled ? "on" : "off");
        return getForUser(userId);
    }

    @Transactional(readOnly = true)
    public boolean isEnabled(String userId, ChannelKind kind) {
        return repository.findByUserIdAndKind(userId, kind)
                .map(UserIntegrationSetting::isNotificationsEnabled)
                .orElse(true);
    }

    private static void requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new RequestValidationException("Acting user id is required");
        }
    }
}
