package com.lucidityplatform.common.exception;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

public class OnCooldownException extends LucidityException {
    private final UUID actorId;
    private final String actionCode;
    private final Instant expiresAt;
    private final Duration remaining;

    public OnCooldownException(UUID actorId, String actionCode, Instant expiresAt, Duration remaining) {
        super("ON_COOLDOWN", String.format("Action %s is on cooldown for %d more seconds",
                                            actionCode, remaining.toSeconds()));
        this.actorId    = actorId;
        this.actionCode = actionCode;
        this.expiresAt  = expiresAt;
        this.remaining  = remaining;
    }

    public UUID getActorId() {
        return actorId;
    }

    public String getActionCode() {
        return actionCode;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public Duration getRemaining() {
        return remaining;
    }
}
