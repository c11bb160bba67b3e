package com.z254.watchtower.vigil.notification;

import com.z254.watchtower.vigil.domain.exception.RequestValidationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Transport family of a notification destination. Users opt in or out per kind.
 */
public enum ChannelKind {

    /**
     * Chat webhook accepting a {@code {"content": "..."}} payload.
     */
    CHAT_WEBHOOK,

    /**
     * Paging service accepting Events v2 {@code trigger} payloads.
     */
    PAGING;

    public String param() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    /**
     * Accepts {@code chat-webhook}, {@code chat_webhook} or the constant name, in any case.
     */
    public static ChannelKind fromParam(String value) {
        if (value != null) {
            String normalized = value.trim().replace('_', '-');
            for (ChannelKind kind : values()) {
                if (kind.param().equalsIgnoreCase(normalized)) {
                    return kind;
                }
            }
        }
        throw new RequestValidationException("Unknown integration '" + value + "', expected one of "
                + Arrays.stream(values()).map(ChannelKind::param).collect(Collectors.joining(", ")));
    }
}
