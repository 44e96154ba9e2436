package com.jalarm.delivery;

import reactor.core.publisher.Mono;

/**
 * Runs a recurring schedule's payload downstream. Whatever the runner triggers is
 * responsible for the eventual user-facing message.
 */
public interface TaskRunner {

    /**
     * @param botToken bot the run reports through; null or blank uses the default bot
     */
    Mono<Void> run(String ownerId, String scheduleId, String payload, String botToken);
}
