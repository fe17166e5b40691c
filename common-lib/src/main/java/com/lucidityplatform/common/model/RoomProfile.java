package com.lucidityplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * World geography needed to resolve environmental flux for a room.
 * {@code zone} is the region, {@code subZone} the sub-region and
 * {@code environment} the location type.
 */
public record RoomProfile(
    @JsonProperty("id")          String id,
    @JsonProperty("plane")       String plane,
    @JsonProperty("zone")        String zone,
    @JsonProperty("subZone")     String subZone,
    @JsonProperty("environment") String environment
) {}
