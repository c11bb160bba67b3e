package com.z254.watchtower.vigil.api.v1;

import com.z254.watchtower.vigil.api.dto.IntegrationSettingDto;
import com.z254.watchtower.vigil.domain.model.UserIntegrationSetting;
import com.z254.watchtower.vigil.notification.ChannelKind;
import com.z254.watchtower.vigil.notification.IntegrationSettingsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Lets the acting user switch notifications on or off per channel kind.
 */
@RestController
@RequestMapping("/api/v1/integrations/settings")
@Tag(name = "Integration settings", description = "Per-user notification preferences")
public class IntegrationSettingsController {

    private final IntegrationSettingsService settingsService;

    public IntegrationSettingsController(IntegrationSettingsService settingsService) {
        this.settingsService = settingsService;
    }

    @GetMapping
    @Operation(summary = "Get settings", description = "One entry per channel kind, enabled unless saved otherwise")
    public Mono<ResponseEntity<List<IntegrationSettingDto>>> getSettings(
            @Parameter(description = "Acting user") @RequestHeader(ApiHeaders.USER_ID) String actorId) {

        return Mono.fromCallable(() -> ResponseEntity.ok(toDtos(settingsService.getForUser(actorId))))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PutMapping("/{kind}")
    @Operation(summary = "Update setting", description = "Enable or disable notifications for one channel kind")
    public Mono<ResponseEntity<List<IntegrationSettingDto>>> updateSetting(
            @Parameter(description = "Channel kind, e.g. chat-webhook or paging") @PathVariable String kind,
            @Parameter(description = "Acting user") @RequestHeader(ApiHeaders.USER_ID) String actorId,
            @Valid @RequestBody SettingUpdateRequest request) {

        return Mono.fromCallable(() -> ResponseEntity.ok(toDtos(settingsService.setEnabledForUser(
                        actorId, ChannelKind.fromParam(kind), request.getNotificationsEnabled()))))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private static List<IntegrationSettingDto> toDtos(List<UserIntegrationSetting> settings) {
        return settings.stream().map(IntegrationSettingDto::from).toList();
    }

    @lombok.Data
    public static class SettingUpdateRequest {
        @NotNull
        private Boolean notificationsEnabled;
    }
}
