package com.lucidityplatform.common.observer;

import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Emergency relocation for an actor who reached the absolute floor.
 *
 * <p>May be long-running. The caller subscribes fire-and-forget, so a synchronous
 * implementation should wrap its work in {@code Mono.fromRunnable}.
 */
@FunctionalInterface
public interface FailoverHandler {

    Mono<Void> failover(UUID actorId, int currentScore);
}
