package com.lucidityplatform.ledger.adapter;

import com.lucidityplatform.common.observer.FailoverHandler;
import com.lucidityplatform.ledger.client.WorldClient;
import com.lucidityplatform.ledger.store.LedgerStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Relocates an actor who hit the absolute floor to the sanitarium. Hallucination
 * timers are cleared first so the actor does not arrive mid-episode.
 */
@Component
public class SanitariumFailoverHandler implements FailoverHandler {

    private static final Logger log = LoggerFactory.getLogger(SanitariumFailoverHandler.class);

    static final String HALLUCINATION_PREFIX = "hallucination_";
    static final String RELOCATION_REASON    = "catatonia_failover";

    private final LedgerStore store;
    private final WorldClient worldClient;
    private final String sanitariumRoomId;

    public SanitariumFailoverHandler(LedgerStore store,
                                     WorldClient worldClient,
                                     @Value("${lucidity.failover.room-id:earth_arkhamcity_sanitarium_room_foyer_001}")
                                     String sanitariumRoomId) {
        this.store            = store;
        this.worldClient      = worldClient;
        this.sanitariumRoomId = sanitariumRoomId;
    }

    @Override
    public Mono<Void> failover(UUID actorId, int currentScore) {
        return store.deleteCooldowns(actorId, HALLUCINATION_PREFIX)
            .doOnNext(cleared -> log.info("Hallucination timers cleared. actorId={} count={}", actorId, cleared))
            .then(worldClient.relocate(actorId, sanitariumRoomId, RELOCATION_REASON))
            .doOnSuccess(v -> log.info("Sanitarium relocation requested. actorId={} score={} roomId={}",
                                       actorId, currentScore, sanitariumRoomId));
    }
}
