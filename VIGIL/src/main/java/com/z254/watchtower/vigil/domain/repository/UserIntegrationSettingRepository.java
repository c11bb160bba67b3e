package com.z254.watchtower.vigil.domain.repository;

import com.z254.watchtower.vigil.domain.model.UserIntegrationSetting;
import com.z254.watchtower.vigil.notification.ChannelKind;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface UserIntegrationSettingRepository extends JpaRepository<UserIntegrationSetting, Long> {

    List<UserIntegrationSetting> findByUserId(String userId);

    Optional<UserIntegrationSetting> findByUserIdAndKind(String userId, ChannelKind kind);
}
