package com.jalarm.delivery;

import com.jalarm.reminder.DeliveryTarget;
import reactor.core.publisher.Mono;

/**
 * Delivers a due reminder. Completes empty on success and errors on failure; the
 * caller bounds the call with its own timeout.
 */
public interface Notifier {

    String channelType();

    Mono<Void> send(DeliveryTarget target, String payload);
}
