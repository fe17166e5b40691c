package com.lucidityplatform.common.flux;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Environmental flux profiles, most specific first: room, sub-zone, zone,
 * environment type, then the global default.
 */
public record EnvironmentFluxConfig(
    @JsonProperty("default")             double defaultFlux,
    @JsonProperty("environmentDefaults") Map<String, FluxProfile> environmentDefaults,
    @JsonProperty("zoneOverrides")       Map<String, FluxProfile> zoneOverrides,
    @JsonProperty("subZoneOverrides")    Map<String, FluxProfile> subZoneOverrides,
    @JsonProperty("roomOverrides")       Map<String, FluxProfile> roomOverrides
) {
    public EnvironmentFluxConfig {
        environmentDefaults = environmentDefaults == null ? Map.of() : Map.copyOf(environmentDefaults);
        zoneOverrides       = zoneOverrides == null ? Map.of() : Map.copyOf(zoneOverrides);
        subZoneOverrides    = subZoneOverrides == null ? Map.of() : Map.copyOf(subZoneOverrides);
        roomOverrides       = roomOverrides == null ? Map.of() : Map.copyOf(roomOverrides);
    }
}
