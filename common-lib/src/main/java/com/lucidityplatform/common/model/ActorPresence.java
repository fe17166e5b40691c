package com.lucidityplatform.common.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Read-only projection of a character used by the passive flux scheduler.
 *
 * @param maxScore lucidity ceiling shown to the client; 100 unless the character
 *                 registry says otherwise
 */
public record ActorPresence(
    UUID actorId,
    String currentRoomId,
    Instant lastActiveAt,
    Instant createdAt,
    int maxScore
) {
    public static final int DEFAULT_MAX_SCORE = 100;
}
