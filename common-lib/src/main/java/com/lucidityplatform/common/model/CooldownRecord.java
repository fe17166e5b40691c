package com.lucidityplatform.common.model;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Expiry of a rate-limited action for one actor. Absence of a record means the
 * action is available.
 */
public record CooldownRecord(
    UUID actorId,
    String actionCode,
    Instant expiresAt
) {
    public boolean isActive(Instant now) {
        return expiresAt != null && expiresAt.isAfter(now);
    }

    /** Time left until expiry, {@link Duration#ZERO} once expired. */
    public Duration remaining(Instant now) {
        if (!isActive(now)) {
            return Duration.ZERO;
        }
        return Duration.between(now, expiresAt);
    }
}
