package com.lucidityplatform.ledger.client;

import com.lucidityplatform.common.model.RoomProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Client for the world directory: room geography and actor relocation.
 */
@Component
public class WorldClient {

    private static final Logger log = LoggerFactory.getLogger(WorldClient.class);

    private final WebClient worldClient;

    public WorldClient(WebClient worldClient) {
        this.worldClient = worldClient;
    }

    /** Empty when the room is unknown or the directory is unreachable. */
    public Mono<RoomProfile> getRoom(String roomId) {
        return worldClient.get()
            .uri("/api/v1/world/rooms/{roomId}", roomId)
            .retrieve()
            .bodyToMono(RoomProfile.class)
            .doOnError(e -> log.warn("Room lookup failed. roomId={} cause={}", roomId, e.toString()))
            .onErrorResume(e -> Mono.empty());
    }

    /** Errors propagate to the caller. */
    public Mono<Void> relocate(UUID actorId, String targetRoomId, String reason) {
        return worldClient.post()
            .uri("/api/v1/world/actors/{actorId}/relocate", actorId)
            .bodyValue(new RelocateRequest(targetRoomId, reason))
            .retrieve()
            .toBodilessEntity()
            .doOnNext(r -> log.info("Relocation accepted. actorId={} roomId={} status={}",
                                    actorId, targetRoomId, r.getStatusCode()))
            .then();
    }
}
