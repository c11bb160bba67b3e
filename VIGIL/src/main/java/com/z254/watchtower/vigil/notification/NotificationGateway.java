package com.z254.watchtower.vigil.notification;

import reactor.core.publisher.Mono;

/**
 * Delivers a message to one destination.
 */
public interface NotificationGateway {

    /**
     * @return completes when the destination accepted the message, errors otherwise
     */
    Mono<Void> send(NotificationMessage message, NotificationDestination destination);
}
