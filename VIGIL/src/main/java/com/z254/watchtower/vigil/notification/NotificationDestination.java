package com.z254.watchtower.vigil.notification;

import com.z254.watchtower.vigil.config.VigilProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Where a notification is delivered.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationDestination {
    private String name;
    private ChannelKind kind;
    private String url;
    private String routingKey;

    public static NotificationDestination from(VigilProperties.Notifications.Channel channel) {
        return NotificationDestination.builder()
                .name(channel.getName())
                .kind(channel.getKind())
                .url(channel.getUrl())
                .routingKey(channel.getRoutingKey())
                .build();
    }
}
