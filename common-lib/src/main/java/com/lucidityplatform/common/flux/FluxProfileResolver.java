package com.lucidityplatform.common.flux;

import com.lucidityplatform.common.model.RoomProfile;

import java.time.Instant;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves the base flux of a room.
 *
 * <p>Order, first match wins:
 * <ol>
 *   <li>world override ({@link WorldOverrideTable})</li>
 *   <li>room override</li>
 *   <li>sub-zone override</li>
 *   <li>zone override</li>
 *   <li>environment default, day or night variant</li>
 *   <li>global default</li>
 * </ol>
 * An unknown room (geography lookup failed) gets the global default.
 */
public final class FluxProfileResolver {

    private final EnvironmentFluxConfig config;
    private final WorldOverrideTable overrides;
    private final ZoneId zone;

    public FluxProfileResolver(EnvironmentFluxConfig config, WorldOverrideTable overrides, ZoneId zone) {
        this.config    = config;
        this.overrides = overrides == null ? WorldOverrideTable.empty() : overrides;
        this.zone      = zone;
    }

    public FluxProfileResolver withOverrides(WorldOverrideTable replacement) {
        return new FluxProfileResolver(config, replacement, zone);
    }

    public FluxContext resolve(String roomId, RoomProfile room, Instant at) {
        DayPeriod period = DayPeriod.at(at, zone);
        double fallback = config.defaultFlux();
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("room_id", roomId);
        metadata.put("period", period.name().toLowerCase());

        if (room == null) {
            metadata.put("zone", null);
            metadata.put("sub_zone", null);
            return new FluxContext(fallback, "default", Set.of(), metadata);
        }

        metadata.put("zone", room.zone());
        metadata.put("sub_zone", room.subZone());
        Set<String> tags = new HashSet<>();
        if (room.environment() != null) {
            tags.add(room.environment());
        }

        double baseFlux = fallback;
        String source = "default";
        if (room.id() != null && config.roomOverrides().containsKey(room.id())) {
            baseFlux = config.roomOverrides().get(room.id()).valueFor(period, fallback);
            source = "room:" + room.id();
        } else if (room.subZone() != null && config.subZoneOverrides().containsKey(room.subZone())) {
            baseFlux = config.subZoneOverrides().get(room.subZone()).valueFor(period, fallback);
            source = "sub_zone:" + room.subZone();
        } else if (room.zone() != null && config.zoneOverrides().containsKey(room.zone())) {
            baseFlux = config.zoneOverrides().get(room.zone()).valueFor(period, fallback);
            source = "zone:" + room.zone();
        } else if (room.environment() != null && config.environmentDefaults().containsKey(room.environment())) {
            baseFlux = config.environmentDefaults().get(room.environment()).valueFor(period, fallback);
            source = "environment:" + room.environment();
        }

        Optional<WorldOverrideTable.Match> override = overrides.lookup(room);
        if (override.isPresent()) {
            baseFlux = override.get().flux();
            source = override.get().source();
            metadata.put("lucidity_rate_override", true);
        }

        return new FluxContext(baseFlux, source, tags, metadata);
    }
}
