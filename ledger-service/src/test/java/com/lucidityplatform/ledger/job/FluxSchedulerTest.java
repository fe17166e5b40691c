package com.lucidityplatform.ledger.job;

import com.lucidityplatform.common.event.LucidityStatus;
import com.lucidityplatform.common.flux.EnvironmentFluxConfig;
import com.lucidityplatform.common.flux.FluxProfile;
import com.lucidityplatform.common.ledger.LiabilityRoller;
import com.lucidityplatform.common.model.ActorPresence;
import com.lucidityplatform.common.model.AdjustmentLogEntry;
import com.lucidityplatform.common.model.RoomProfile;
import com.lucidityplatform.ledger.cache.RoomProfileCache;
import com.lucidityplatform.ledger.client.WorldClient;
import com.lucidityplatform.ledger.model.ZoneLucidityRuleEntity;
import com.lucidityplatform.ledger.repository.ZoneLucidityRuleRepository;
import com.lucidityplatform.ledger.service.AdjustmentEngine;
import com.lucidityplatform.ledger.support.InMemoryLedgerStore;
import com.lucidityplatform.ledger.support.MutableClock;
import com.lucidityplatform.ledger.support.RecordingEventPublisher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class FluxSchedulerTest {

    private static final Instant NIGHT = Instant.parse("2024-05-01T23:00:00Z");

    private static final EnvironmentFluxConfig ENVIRONMENT = new EnvironmentFluxConfig(
        0.0,
        Map.of("graveyard", FluxProfile.dayNight(-0.4, -0.8),
               "mist",      FluxProfile.constant(-0.25),
               "sanctuary", FluxProfile.dayNight(0.6, 0.3)),
        Map.of(), Map.of(), Map.of());

    private MutableClock clock;
    private InMemoryLedgerStore store;
    private RecordingEventPublisher publisher;
    private WorldClient worldClient;
    private ZoneLucidityRuleRepository ruleRepository;
    private FluxScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock          = new MutableClock(NIGHT);
        store          = new InMemoryLedgerStore(clock);
        publisher      = new RecordingEventPublisher();
        worldClient    = mock(WorldClient.class);
        ruleRepository = mock(ZoneLucidityRuleRepository.class);
        when(worldClient.getRoom(anyString())).thenReturn(Mono.empty());
        room("crypt",  "earth", "arkham", null, "graveyard");
        room("fog",    "earth", "arkham", null, "mist");
        room("chapel", "earth", "arkham", null, "sanctuary");

        AdjustmentEngine engine = new AdjustmentEngine(store, LiabilityRoller.withDefaults(), List.of(),
                                                       publisher, clock);
        scheduler = new FluxScheduler(store, engine, worldClient, new RoomProfileCache(clock, Duration.ofSeconds(60)),
                                      ruleRepository, publisher, ENVIRONMENT, clock);
        scheduler.configure(1, 10, Duration.ofMinutes(5));
    }

    private void room(String id, String plane, String zone, String subZone, String environment) {
        when(worldClient.getRoom(id)).thenReturn(Mono.just(new RoomProfile(id, plane, zone, subZone, environment)));
    }

    private FluxTickSummary tick(long tick) {
        return scheduler.processTick(tick, clock.instant()).block();
    }

    // ── cadence ───────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("cadence gating")
    class Cadence {

        @Test
        @DisplayName("only every ticksPerCadence-th tick evaluates actors")
        void gating() {
            scheduler.configure(6, 10, Duration.ofMinutes(5));
            store.registerActor("crypt", 100);

            assertFalse(tick(5).cadence());
            assertTrue(tick(6).cadence());
            assertEquals(1, tick(12).evaluated());
        }

        @Test
        @DisplayName("ticksPerCadence of 1 fires every tick")
        void everyTick() {
            assertTrue(scheduler.isCadence(1));
            assertTrue(scheduler.isCadence(7));
        }
    }

    // ── flux accumulation ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("flux accumulation")
    class Accumulation {

        @Test
        @DisplayName("fractional flux summing to -2 emits exactly -2")
        void residualSum() {
            UUID actor = store.registerActor("fog", 100);
            for (int t = 1; t <= 8; t++) {
                tick(t);
            }
            assertEquals(98, store.record(actor).score());
            int emitted = store.logEntries().stream().mapToInt(AdjustmentLogEntry::delta).sum();
            assertEquals(-2, emitted);
        }

        @Test
        @DisplayName("night graveyard drains 0.8 per cadence")
        void nightGraveyard() {
            UUID actor = store.registerActor("crypt", 100);
            tick(1);
            assertNull(store.record(actor));
            FluxTickSummary second = tick(2);
            assertEquals(1, second.adjustments());
            assertEquals(99, store.record(actor).score());

            AdjustmentLogEntry entry = store.logEntries().get(0);
            assertEquals("passive_flux", entry.reasonCode());
            assertEquals("crypt", entry.locationId());
            assertEquals("environment:graveyard", entry.metadata().get("source"));
            assertEquals(List.of("graveyard"), entry.metadata().get("context_tags"));
        }

        @Test
        @DisplayName("unknown room falls back to the global default")
        void unknownRoom() {
            store.registerActor("void", 100);
            FluxTickSummary summary = tick(1);
            assertEquals(1, summary.evaluated());
            assertEquals(0, summary.adjustments());
        }

        @Test
        @DisplayName("actors without a room are skipped")
        void noRoom() {
            store.registerActor(null, 100);
            assertEquals(1, tick(1).skipped());
        }
    }

    // ── companions and resistance ─────────────────────────────────────────────

    @Nested
    @DisplayName("companions and resistance")
    class Modifiers {

        @Test
        @DisplayName("a stable companion softens the drain")
        void stableCompanion() {
            UUID a = store.registerActor("fog", 100);
            UUID b = store.registerActor("fog", 100);
            for (int t = 1; t <= 8; t++) {
                tick(t);
            }
            // (-0.25 + 0.1) * 8 = -1.2
            assertEquals(99, store.record(a).score());
            assertEquals(99, store.record(b).score());
        }

        @Test
        @DisplayName("an impaired companion deepens the drain")
        void impairedCompanion() {
            UUID a = store.registerActor("fog", 100);
            UUID b = store.registerActor("fog", 100);
            store.seed(a, 80);
            store.seed(b, 10);
            for (int t = 1; t <= 4; t++) {
                tick(t);
            }
            // a: (-0.25 - 0.2) * 4 = -1.8 → -1
            assertEquals(79, store.record(a).score());
        }

        @Test
        @DisplayName("room change resets the resistance counter")
        void roomChangeResets() {
            UUID actor = store.registerActor("fog", 100);
            tick(1);
            tick(2);
            assertEquals(2, scheduler.tracker(actor).cadencesInRoom());

            ActorPresence moved = store.presence(actor);
            store.updatePresence(new ActorPresence(actor, "crypt", moved.lastActiveAt(),
                                                   moved.createdAt(), moved.maxScore()));
            tick(3);
            assertEquals(1, scheduler.tracker(actor).cadencesInRoom());
            assertEquals("crypt", scheduler.tracker(actor).roomId());
        }
    }

    // ── robustness ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("robustness")
    class Robustness {

        @Test
        @DisplayName("one actor's failure does not abort the tick")
        void perActorFailure() {
            UUID broken = store.registerActor("crypt", 100);
            UUID healthy = store.registerActor("crypt", 100);
            store.failWritesFor(broken);
            // each: -0.8 + 0.1 = -0.7 → first emission on cadence 2
            tick(1);
            FluxTickSummary summary = tick(2);

            assertEquals(1, summary.failed());
            assertEquals(1, summary.adjustments());
            assertEquals(99, store.record(healthy).score());
        }

        @Test
        @DisplayName("a failed apply returns its delta to the residual")
        void failedDeltaCarried() {
            UUID actor = store.registerActor("crypt", 100);
            tick(1);

            store.failWrites(true);
            FluxTickSummary failed = tick(2);
            assertEquals(1, failed.failed());
            assertEquals(-1.6, scheduler.tracker(actor).residual(), 1e-9);

            store.failWrites(false);
            tick(3);
            // -0.8 × 3 = -2.4 → both owed points land on cadence 3
            assertEquals(98, store.record(actor).score());
            assertEquals(-0.4, scheduler.tracker(actor).residual(), 1e-9);
        }

        @Test
        @DisplayName("trackers of actors no longer eligible are pruned")
        void pruning() {
            UUID actor = store.registerActor("fog", 100);
            tick(1);
            assertEquals(1, scheduler.trackerCount());

            clock.advance(Duration.ofMinutes(10));
            tick(2);
            assertEquals(0, scheduler.trackerCount());
            assertNull(scheduler.tracker(actor));
        }
    }

    // ── world overrides ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("world overrides")
    class Overrides {

        @Test
        @DisplayName("zone rule replaces the environment profile")
        void ruleApplied() {
            ZoneLucidityRuleEntity rule = new ZoneLucidityRuleEntity();
            rule.setPlane("earth");
            rule.setZone("arkham");
            rule.setDrainRate(2.0);
            when(ruleRepository.findAll()).thenReturn(Flux.just(rule));
            scheduler.loadWorldOverrides().block();

            UUID actor = store.registerActor("chapel", 100);
            tick(1);

            assertEquals(98, store.record(actor).score());
            assertEquals("lucidity_rule:earth/arkham", store.logEntries().get(0).metadata().get("source"));
        }

        @Test
        @DisplayName("load failure leaves environment profiles in force")
        void loadFailure() {
            when(ruleRepository.findAll()).thenReturn(Flux.error(new IllegalStateException("no table")));
            scheduler.loadWorldOverrides().block();

            UUID actor = store.registerActor("crypt", 100);
            tick(1);
            tick(2);
            assertEquals(99, store.record(actor).score());
        }
    }

    // ── hallucinations ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("hallucination timers")
    class Hallucinations {

        @Test
        @DisplayName("impaired actors hallucinate once per timer interval")
        void timerGates() {
            UUID actor = store.registerActor("void", 100);
            store.seed(actor, 10);

            tick(1);
            tick(2);
            assertEquals(1, publisher.count(LucidityStatus.HALLUCINATION));

            clock.advance(Duration.ofMinutes(4));
            store.updatePresence(refreshed(actor));
            tick(3);
            assertEquals(1, publisher.count(LucidityStatus.HALLUCINATION));

            clock.advance(Duration.ofMinutes(2));
            store.updatePresence(refreshed(actor));
            tick(4);
            assertEquals(2, publisher.count(LucidityStatus.HALLUCINATION));
            assertEquals(10, publisher.statuses().get(1).score());
        }

        @Test
        @DisplayName("drift into an impaired tier triggers the timer in the same cadence")
        void driftIntoImpairment() {
            UUID actor = store.registerActor("crypt", 100);
            store.seed(actor, 20);

            tick(1);
            assertEquals(0, publisher.count(LucidityStatus.HALLUCINATION));

            tick(2);
            assertEquals(19, store.record(actor).score());
            assertEquals(1, publisher.count(LucidityStatus.HALLUCINATION));
            assertEquals(19, publisher.statuses().get(0).score());
        }

        @Test
        @DisplayName("stable actors never hallucinate")
        void stableQuiet() {
            store.registerActor("void", 100);
            tick(1);
            assertEquals(0, publisher.count(LucidityStatus.HALLUCINATION));
        }

        private ActorPresence refreshed(UUID actor) {
            ActorPresence p = store.presence(actor);
            return new ActorPresence(actor, p.currentRoomId(), clock.instant(), p.createdAt(), p.maxScore());
        }
    }
}
