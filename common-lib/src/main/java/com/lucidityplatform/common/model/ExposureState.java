package com.lucidityplatform.common.model;

import java.time.Instant;
import java.util.UUID;

/** How often an actor has faced a given hostile archetype. The counter never decays. */
public record ExposureState(
    UUID actorId,
    String archetype,
    int encounterCount,
    Instant lastEncounterAt
) {}
