package com.z254.watchtower.vigil.notification;

import com.z254.watchtower.vigil.domain.exception.RequestValidationException;
import com.z254.watchtower.vigil.domain.model.UserIntegrationSetting;
import com.z254.watchtower.vigil.domain.repository.UserIntegrationSettingRepository;
import com.z254.watchtower.vigil.support.MutableClock;
import com.z254.watchtower.vigil.support.VigilTestConfiguration;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import({IntegrationSettingsService.class, VigilTestConfiguration.class})
class IntegrationSettingsServiceTest {

    @Autowired
    private IntegrationSettingsService service;
    @Autowired
    private UserIntegrationSettingRepository repository;
    @Autowired
    private MutableClock clock;

    @Test
    void unsavedKindsDefaultToEnabled() {
        List<UserIntegrationSetting> settings = service.getForUser("user-1");

        assertThat(settings).extracting(UserIntegrationSetting::getKind)
                .containsExactly(ChannelKind.CHAT_WEBHOOK, ChannelKind.PAGING);
        assertThat(settings).allMatch(UserIntegrationSetting::isNotificationsEnabled);
        assertThat(settings).allMatch(s -> s.getLastSavedAt() == null);
        assertThat(service.isEnabled("user-1", ChannelKind.PAGING)).isTrue();
        assertThat(repository.count()).isZero();
    }

    @Test
    void savingTwiceUpdatesTheSameRow() {
        service.setEnabledForUser("user-1", ChannelKind.PAGING, false);
        clock.advance(Duration.ofMinutes(5));

        List<UserIntegrationSetting> settings = service.setEnabledForUser("user-1", ChannelKind.PAGING, true);

        assertThat(repository.findByUserId("user-1")).hasSize(1);
        UserIntegrationSetting paging = settings.get(1);
        assertThat(paging.isNotificationsEnabled()).isTrue();
        assertThat(paging.getLastSavedAt()).isEqualTo(VigilTestConfiguration.EPOCH.plus(Duration.ofMinutes(5)));
    }

    @Test
    void optOutOnlyAffectsThatUserAndKind() {
        service.setEnabledForUser("user-1", ChannelKind.PAGING, false);

        assertThat(service.isEnabled("user-1", ChannelKind.PAGING)).isFalse();
        assertThat(service.isEnabled("user-1", ChannelKind.CHAT_WEBHOOK)).isTrue();
        assertThat(service.isEnabled("user-2", ChannelKind.PAGING)).isTrue();
        assertThat(service.getForUser("user-1")).extracting(UserIntegrationSetting::isNotificationsEnabled)
                .containsExactly(true, false);
    }

    @Test
    void requiresActingUser() {
        assertThatThrownBy(() -> service.getForUser(" "))
                .isInstanceOf(RequestValidationException.class);
        assertThatThrownBy(() -> service.setEnabledForUser(null, ChannelKind.PAGING, false))
                .isInstanceOf(RequestValidationException.class);
    }
}
