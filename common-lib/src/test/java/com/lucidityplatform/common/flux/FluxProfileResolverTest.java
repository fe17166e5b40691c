package com.lucidityplatform.common.flux;

import com.lucidityplatform.common.model.RoomProfile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FluxProfileResolverTest {

    private static final Instant NOON     = Instant.parse("2024-03-01T12:00:00Z");
    private static final Instant MIDNIGHT = Instant.parse("2024-03-01T23:30:00Z");

    private final EnvironmentFluxConfig config = new EnvironmentFluxConfig(
        -0.05,
        Map.of("graveyard", FluxProfile.dayNight(-0.4, -0.8),
               "sanctuary", FluxProfile.dayNight(0.6, 0.3)),
        Map.of("arkham", FluxProfile.constant(-0.1)),
        Map.of("sanitarium", FluxProfile.constant(-0.5)),
        Map.of("room-chapel", new FluxProfile(null, 1.0, null)));

    private final FluxProfileResolver resolver =
        new FluxProfileResolver(config, WorldOverrideTable.empty(), ZoneOffset.UTC);

    @Nested
    @DisplayName("environment hierarchy")
    class Hierarchy {

        @Test
        @DisplayName("environment default uses the day or night variant")
        void environmentDayNight() {
            RoomProfile room = new RoomProfile("r1", "earth", "salem", null, "graveyard");
            assertEquals(-0.4, resolver.resolve("r1", room, NOON).baseFlux(), 1e-9);
            FluxContext night = resolver.resolve("r1", room, MIDNIGHT);
            assertEquals(-0.8, night.baseFlux(), 1e-9);
            assertEquals("environment:graveyard", night.source());
            assertTrue(night.tags().contains("graveyard"));
        }

        @Test
        @DisplayName("zone beats environment, sub-zone beats zone")
        void specificityOrder() {
            RoomProfile zoneRoom = new RoomProfile("r2", "earth", "arkham", null, "sanctuary");
            assertEquals(-0.1, resolver.resolve("r2", zoneRoom, NOON).baseFlux(), 1e-9);

            RoomProfile subZoneRoom = new RoomProfile("r3", "earth", "arkham", "sanitarium", "sanctuary");
            FluxContext context = resolver.resolve("r3", subZoneRoom, NOON);
            assertEquals(-0.5, context.baseFlux(), 1e-9);
            assertEquals("sub_zone:sanitarium", context.source());
        }

        @Test
        @DisplayName("room override without a day value falls back to the default")
        void roomOverrideFallback() {
            RoomProfile room = new RoomProfile("room-chapel", "earth", "arkham", "sanitarium", null);
            assertEquals(1.0, resolver.resolve("room-chapel", room, MIDNIGHT).baseFlux(), 1e-9);
            assertEquals(-0.05, resolver.resolve("room-chapel", room, NOON).baseFlux(), 1e-9);
        }

        @Test
        @DisplayName("unknown room resolves to the global default")
        void unknownRoom() {
            FluxContext context = resolver.resolve("missing", null, NOON);
            assertEquals(-0.05, context.baseFlux(), 1e-9);
            assertEquals("default", context.source());
        }
    }

    @Nested
    @DisplayName("world overrides")
    class WorldOverrides {

        @Test
        @DisplayName("override beats every environment rule")
        void overrideWins() {
            WorldOverrideTable table = WorldOverrideTable.builder()
                .drainRate("earth", "arkham", "sanitarium", 0.25)
                .build();
            RoomProfile room = new RoomProfile("r3", "earth", "arkham", "sanitarium", "sanctuary");
            FluxContext context = resolver.withOverrides(table).resolve("r3", room, NOON);
            assertEquals(-0.25, context.baseFlux(), 1e-9);
            assertEquals("lucidity_rule:earth/arkham/sanitarium", context.source());
            assertEquals(Boolean.TRUE, context.metadata().get("lucidity_rate_override"));
        }

        @Test
        @DisplayName("lookup falls back from sub-zone to zone to plane")
        void wildcardFallback() {
            WorldOverrideTable table = WorldOverrideTable.builder()
                .drainRate("earth", null, null, 0.1)
                .drainRate("earth/innsmouth", null, 0.3)
                .build();
            RoomProfile innsmouth = new RoomProfile("r4", "Earth", "Innsmouth", "docks", null);
            RoomProfile salem     = new RoomProfile("r5", "earth", "salem", null, null);
            assertEquals(-0.3, table.lookup(innsmouth).orElseThrow().flux(), 1e-9);
            assertEquals(-0.1, table.lookup(salem).orElseThrow().flux(), 1e-9);
            assertTrue(table.lookup(new RoomProfile("r6", "dreamlands", null, null, null)).isEmpty());
        }

        @Test
        @DisplayName("rates above 10 are clamped")
        void rateClamped() {
            assertEquals(-10.0, WorldOverrideTable.rateToFlux(100.0), 1e-9);
            assertEquals(-0.1, WorldOverrideTable.rateToFlux(0.1), 1e-9);
            assertEquals("earth|*|*", WorldOverrideTable.key("EARTH", " ", null));
        }
    }
}
