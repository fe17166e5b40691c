package com.lucidityplatform.ledger.service;

import com.lucidityplatform.common.observer.FailoverHandler;
import com.lucidityplatform.common.observer.TransitionObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory view of actors currently in the terminal tier, plus the trigger for
 * emergency relocation at the absolute floor.
 *
 * <p>Membership is not persisted; after a restart it rebuilds as actors cross the
 * threshold again. Failover runs fire-and-forget on the bounded-elastic scheduler so
 * the adjustment that triggered it never waits on the relocation.
 */
@Component
public class CatatoniaRegistry implements TransitionObserver {

    private static final Logger log = LoggerFactory.getLogger(CatatoniaRegistry.class);

    private final Map<UUID, Instant> catatonic = new ConcurrentHashMap<>();
    private final FailoverHandler failoverHandler;

    public CatatoniaRegistry(FailoverHandler failoverHandler) {
        this.failoverHandler = failoverHandler;
    }

    @Override
    public void onCatatoniaEntered(UUID actorId, Instant enteredAt, int currentScore) {
        catatonic.put(actorId, enteredAt);
        log.info("Actor entered catatonia. actorId={} score={} enteredAt={}", actorId, currentScore, enteredAt);
    }

    @Override
    public void onCatatoniaCleared(UUID actorId, Instant resolvedAt) {
        Instant enteredAt = catatonic.remove(actorId);
        log.info("Actor left catatonia. actorId={} enteredAt={} resolvedAt={}", actorId, enteredAt, resolvedAt);
    }

    @Override
    public void onFloorReached(UUID actorId, int currentScore) {
        log.warn("Actor reached the lucidity floor, dispatching failover. actorId={} score={}",
                 actorId, currentScore);
        Mono.defer(() -> failoverHandler.failover(actorId, currentScore))
            .subscribeOn(Schedulers.boundedElastic())
            .subscribe(
                unused -> { },
                err -> log.error("Failover failed. actorId={}", actorId, err),
                ()  -> log.info("Failover completed. actorId={}", actorId)
            );
    }

    public boolean isCatatonic(UUID actorId) {
        return catatonic.containsKey(actorId);
    }

    /** Read-only copy of current memberships. */
    public Map<UUID, Instant> snapshot() {
        return Map.copyOf(catatonic);
    }
}
