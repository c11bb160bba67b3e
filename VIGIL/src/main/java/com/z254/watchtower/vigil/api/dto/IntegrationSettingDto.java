package com.z254.watchtower.vigil.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.z254.watchtower.vigil.domain.model.UserIntegrationSetting;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IntegrationSettingDto {
    /** Channel kind as used in the path, e.g. {@code paging} */
    private String kind;
    private boolean notificationsEnabled;
    /** Null until the user saves this kind once */
    private Instant lastSavedAt;

    public static IntegrationSettingDto from(UserIntegrationSetting setting) {
        return IntegrationSettingDto.builder()
                .kind(setting.getKind().param())
                .notificationsEnabled(setting.isNotificationsEnabled())
                .lastSavedAt(setting.getLastSavedAt())
                .build();
    }
}
