package com.z254.watchtower.vigil.notification;

import com.z254.watchtower.vigil.domain.exception.RequestValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChannelKindTest {

    @ParameterizedTest
    @ValueSource(strings = {"chat-webhook", "chat_webhook", "CHAT_WEBHOOK", " Chat-Webhook "})
    void acceptsParamAndConstantSpellings(String value) {
        assertThat(ChannelKind.fromParam(value)).isEqualTo(ChannelKind.CHAT_WEBHOOK);
    }

    @Test
    void paramIsKebabCase() {
        assertThat(ChannelKind.CHAT_WEBHOOK.param()).isEqualTo("chat-webhook");
        assertThat(ChannelKind.PAGING.param()).isEqualTo("paging");
    }

    @Test
    void rejectsUnknownKindListingValidOnes() {
        assertThatThrownBy(() -> ChannelKind.fromParam("email"))
                .isInstanceOf(RequestValidationException.class)
                .hasMessage("Unknown integration 'email', expected one of chat-webhook, paging");
    }
}
