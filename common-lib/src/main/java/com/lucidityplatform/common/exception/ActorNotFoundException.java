package com.lucidityplatform.common.exception;

import java.util.UUID;

public class ActorNotFoundException extends LucidityException {
    private final UUID actorId;

    public ActorNotFoundException(UUID actorId) {
        super("ACTOR_NOT_FOUND", "No character registered with id " + actorId);
        this.actorId = actorId;
    }

    public UUID getActorId() {
        return actorId;
    }
}
