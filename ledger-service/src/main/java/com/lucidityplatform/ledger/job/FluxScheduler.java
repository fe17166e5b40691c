package com.lucidityplatform.ledger.job;

import com.lucidityplatform.common.event.LucidityEventPublisher;
import com.lucidityplatform.common.event.LucidityStatus;
import com.lucidityplatform.common.event.LucidityStatusEvent;
import com.lucidityplatform.common.flux.AdaptiveResistance;
import com.lucidityplatform.common.flux.CompanionModifier;
import com.lucidityplatform.common.flux.EnvironmentFluxConfig;
import com.lucidityplatform.common.flux.FluxContext;
import com.lucidityplatform.common.flux.FluxProfileResolver;
import com.lucidityplatform.common.flux.FluxTracker;
import com.lucidityplatform.common.flux.WorldOverrideTable;
import com.lucidityplatform.common.model.ActorPresence;
import com.lucidityplatform.common.model.AdjustmentResult;
import com.lucidityplatform.common.model.LucidityRecord;
import com.lucidityplatform.common.model.LucidityTier;
import com.lucidityplatform.common.model.RoomProfile;
import com.lucidityplatform.ledger.cache.RoomProfileCache;
import com.lucidityplatform.ledger.client.WorldClient;
import com.lucidityplatform.ledger.model.ZoneLucidityRuleEntity;
import com.lucidityplatform.ledger.repository.ZoneLucidityRuleRepository;
import com.lucidityplatform.ledger.service.AdjustmentEngine;
import com.lucidityplatform.ledger.store.LedgerStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Passive lucidity drift driven by where actors stand and who stands with them.
 *
 * <p>A fixed-interval tick loop; every {@code ticksPerCadence}-th tick is a cadence:
 * <pre>
 *   eligible actors → room profiles → per actor (sequential):
 *       base flux + companion flux → adaptive resistance → residual carry
 *   → apply non-zero deltas (bounded concurrency) → hallucination timers → prune
 * </pre>
 *
 * <p>Ticks never overlap. Like the rest of the platform's schedulers, each tick is a
 * fresh {@link Mono} pipeline whose terminal {@code subscribe()} schedules the next one,
 * on success, on error and on timeout alike.
 *
 * <p>Tracker state is touched only inside the planning step of a tick, which runs on
 * one thread at a time.
 */
@Component
public class FluxScheduler {

    private static final Logger log = LoggerFactory.getLogger(FluxScheduler.class);

    static final Duration ACTIVE_WINDOW      = Duration.ofMinutes(5);
    static final Duration NEW_ACTOR_WINDOW   = Duration.ofHours(1);
    static final String   REASON             = "passive_flux";
    static final String   HALLUCINATION_TIMER = "hallucination_timer";

    private final LedgerStore store;
    private final AdjustmentEngine engine;
    private final WorldClient worldClient;
    private final RoomProfileCache roomCache;
    private final ZoneLucidityRuleRepository ruleRepository;
    private final LucidityEventPublisher publisher;
    private final Clock clock;

    private final Map<UUID, FluxTracker> trackers = new ConcurrentHashMap<>();
    private final AtomicLong tickCounter = new AtomicLong();

    private volatile FluxProfileResolver resolver;
    private volatile Disposable pendingTick;
    private volatile boolean stopped;

    @Value("${lucidity.flux.enabled:true}")
    private boolean enabled = true;

    @Value("${lucidity.flux.tick-interval:10s}")
    private Duration tickInterval = Duration.ofSeconds(10);

    @Value("${lucidity.flux.ticks-per-cadence:6}")
    private int ticksPerCadence = 6;

    @Value("${lucidity.flux.resistance-window:10}")
    private int resistanceWindow = AdaptiveResistance.DEFAULT_WINDOW;

    @Value("${lucidity.flux.tick-timeout:30s}")
    private Duration tickTimeout = Duration.ofSeconds(30);

    @Value("${lucidity.flux.apply-concurrency:8}")
    private int applyConcurrency = 8;

    @Value("${lucidity.flux.hallucination-interval:5m}")
    private Duration hallucinationInterval = Duration.ofMinutes(5);

    public FluxScheduler(LedgerStore store,
                         AdjustmentEngine engine,
                         WorldClient worldClient,
                         RoomProfileCache roomCache,
                         ZoneLucidityRuleRepository ruleRepository,
                         LucidityEventPublisher publisher,
                         EnvironmentFluxConfig environmentConfig,
                         Clock clock) {
        this.store          = store;
        this.engine         = engine;
        this.worldClient    = worldClient;
        this.roomCache      = roomCache;
        this.ruleRepository = ruleRepository;
        this.publisher      = publisher;
        this.clock          = clock;
        this.resolver       = new FluxProfileResolver(environmentConfig, WorldOverrideTable.empty(), ZoneOffset.UTC);
    }

    @PostConstruct
    public void start() {
        if (!enabled) {
            log.info("Passive flux scheduler disabled");
            return;
        }
        log.info("Passive flux scheduler started. tickInterval={} ticksPerCadence={} resistanceWindow={}",
                 tickInterval, ticksPerCadence, resistanceWindow);
        loadWorldOverrides()
            .doFinally(signal -> scheduleNextTick(tickInterval))
            .subscribe();
    }

    @PreDestroy
    public void stop() {
        stopped = true;
        Disposable pending = pendingTick;
        if (pending != null) {
            pending.dispose();
        }
        log.info("Passive flux scheduler stopped. ticks={}", tickCounter.get());
    }

    // ── tick loop ─────────────────────────────────────────────────────────────

    private void scheduleNextTick(Duration delay) {
        if (stopped) {
            return;
        }
        pendingTick = Mono.delay(delay)
            .then(Mono.defer(() -> processTick(tickCounter.incrementAndGet(), clock.instant())
                .timeout(tickTimeout)))
            .subscribe(
                summary -> {
                    if (summary.cadence()) {
                        log.info("FLUX_TICK tick={} evaluated={} adjustments={} skipped={} failed={}",
                                 summary.tick(), summary.evaluated(), summary.adjustments(),
                                 summary.skipped(), summary.failed());
                    }
                    scheduleNextTick(tickInterval);
                },
                err -> {
                    log.error("Passive flux tick failed, continuing. tick={}", tickCounter.get(), err);
                    scheduleNextTick(tickInterval);
                }
            );
    }

    boolean isCadence(long tick) {
        return ticksPerCadence <= 1 || tick % ticksPerCadence == 0;
    }

    /** Runs one tick. Non-cadence ticks complete immediately. */
    public Mono<FluxTickSummary> processTick(long tick, Instant now) {
        if (!isCadence(tick)) {
            return Mono.just(FluxTickSummary.idle(tick));
        }
        return store.listActiveActors(now.minus(ACTIVE_WINDOW), now.minus(NEW_ACTOR_WINDOW))
            .collectList()
            .flatMap(actors -> {
                if (actors.isEmpty()) {
                    trackers.clear();
                    return Mono.just(new FluxTickSummary(tick, true, 0, 0, 0, 0));
                }
                List<UUID> actorIds = actors.stream().map(ActorPresence::actorId).toList();
                return store.findRecords(actorIds)
                    .collectMap(LucidityRecord::actorId)
                    .zipWith(resolveRooms(actors))
                    .flatMap(loaded -> runCadence(tick, now, actors, loaded.getT1(), loaded.getT2()));
            });
    }

    private Mono<FluxTickSummary> runCadence(long tick, Instant now, List<ActorPresence> actors,
                                             Map<UUID, LucidityRecord> records, Map<String, RoomProfile> rooms) {
        List<FluxPlan> plans = new ArrayList<>();
        int skipped = 0;
        Map<String, List<UUID>> occupants = occupantsByRoom(actors);
        for (ActorPresence actor : actors) {
            if (actor.currentRoomId() == null) {
                skipped++;
                continue;
            }
            FluxPlan plan = planFor(actor, tick, now, records, rooms, occupants);
            if (plan.delta() != 0) {
                plans.add(plan);
            }
        }
        pruneTrackers(actors);

        int evaluated = actors.size();
        int skippedTotal = skipped;
        return Flux.fromIterable(plans)
            .flatMap(this::applyPlanned, Math.max(1, applyConcurrency))
            .collectList()
            .flatMap(outcomes -> {
                Map<UUID, AdjustmentResult> adjusted = new HashMap<>();
                for (FluxOutcome outcome : outcomes) {
                    if (outcome.result() != null) {
                        adjusted.put(outcome.actorId(), outcome.result());
                    }
                }
                return runHallucinationTimers(actors, records, adjusted, now)
                    .thenReturn(new FluxTickSummary(tick, true, evaluated, adjusted.size(), skippedTotal,
                                                    outcomes.size() - adjusted.size()));
            });
    }

    // ── per-actor planning (sequential) ───────────────────────────────────────

    private FluxPlan planFor(ActorPresence actor, long tick, Instant now,
                                      Map<UUID, LucidityRecord> records, Map<String, RoomProfile> rooms,
                                      Map<String, List<UUID>> occupants) {
        String roomId = actor.currentRoomId();
        FluxTracker tracker = trackers.computeIfAbsent(actor.actorId(), id -> new FluxTracker());
        int cadencesInRoom = tracker.enterCadence(roomId);

        FluxContext context = resolver.resolve(roomId, rooms.get(roomId), now);

        List<LucidityTier> companions = new ArrayList<>();
        for (UUID other : occupants.getOrDefault(roomId, List.of())) {
            if (!other.equals(actor.actorId())) {
                companions.add(tierOf(records, other));
            }
        }
        double companionFlux = CompanionModifier.compute(companions);
        double totalFlux = AdaptiveResistance.apply(context.baseFlux() + companionFlux,
                                                    cadencesInRoom, resistanceWindow);
        int delta = tracker.accumulate(totalFlux);

        Map<String, Object> metadata = new HashMap<>(context.metadata());
        metadata.put("context_tags", context.tags().stream().sorted().toList());
        metadata.put("source", context.source());
        metadata.put("base_flux", context.baseFlux());
        metadata.put("companion_flux", companionFlux);
        metadata.put("total_flux", totalFlux);
        metadata.put("tick_count", tick);
        metadata.put("cadences_in_room", cadencesInRoom);
        metadata.put("residual", tracker.residual());

        log.debug("Flux planned. actorId={} roomId={} base={} companion={} total={} delta={} residual={}",
                  actor.actorId(), roomId, context.baseFlux(), companionFlux, totalFlux, delta, tracker.residual());
        return new FluxPlan(actor.actorId(), delta, roomId, metadata);
    }

    /** A failed apply hands its delta back to the tracker for the next cadence. */
    private Mono<FluxOutcome> applyPlanned(FluxPlan plan) {
        return engine.apply(plan.actorId(), plan.delta(), REASON, plan.metadata(), plan.roomId())
            .map(result -> new FluxOutcome(plan.actorId(), result))
            .onErrorResume(e -> {
                FluxTracker tracker = trackers.get(plan.actorId());
                if (tracker != null) {
                    tracker.restore(plan.delta());
                }
                log.warn("Passive flux adjustment failed. actorId={} delta={} cause={}",
                         plan.actorId(), plan.delta(), e.toString());
                return Mono.just(new FluxOutcome(plan.actorId(), null));
            });
    }

    private void pruneTrackers(List<ActorPresence> eligible) {
        Set<UUID> keep = new HashSet<>();
        for (ActorPresence actor : eligible) {
            keep.add(actor.actorId());
        }
        trackers.keySet().retainAll(keep);
    }

    /** Actors without a record count as stable. */
    private static LucidityTier tierOf(Map<UUID, LucidityRecord> records, UUID actorId) {
        LucidityRecord record = records.get(actorId);
        return record == null ? LucidityTier.STABLE : record.tier();
    }

    private static LucidityTier currentTier(Map<UUID, LucidityRecord> records,
                                            Map<UUID, AdjustmentResult> adjusted, UUID actorId) {
        AdjustmentResult result = adjusted.get(actorId);
        return result != null ? result.newTier() : tierOf(records, actorId);
    }

    private static int currentScore(Map<UUID, LucidityRecord> records,
                                    Map<UUID, AdjustmentResult> adjusted, UUID actorId) {
        AdjustmentResult result = adjusted.get(actorId);
        if (result != null) {
            return result.newScore();
        }
        LucidityRecord record = records.get(actorId);
        return record == null ? LucidityRecord.INITIAL_SCORE : record.score();
    }

    private static Map<String, List<UUID>> occupantsByRoom(List<ActorPresence> actors) {
        Map<String, List<UUID>> occupants = new LinkedHashMap<>();
        for (ActorPresence actor : actors) {
            if (actor.currentRoomId() != null) {
                occupants.computeIfAbsent(actor.currentRoomId(), k -> new ArrayList<>()).add(actor.actorId());
            }
        }
        return occupants;
    }

    // ── room geography ────────────────────────────────────────────────────────

    private Mono<Map<String, RoomProfile>> resolveRooms(List<ActorPresence> actors) {
        Set<String> roomIds = new LinkedHashSet<>();
        for (ActorPresence actor : actors) {
            if (actor.currentRoomId() != null) {
                roomIds.add(actor.currentRoomId());
            }
        }
        return Flux.fromIterable(roomIds)
            .flatMap(roomId -> lookupRoom(roomId).map(profile -> Map.entry(roomId, profile)))
            .collectMap(Map.Entry::getKey, Map.Entry::getValue);
    }

    private Mono<RoomProfile> lookupRoom(String roomId) {
        RoomProfile cached = roomCache.get(roomId);
        if (cached != null) {
            return Mono.just(cached);
        }
        return worldClient.getRoom(roomId)
            .doOnNext(profile -> roomCache.put(roomId, profile));
    }

    // ── hallucination timers ──────────────────────────────────────────────────

    /** Scores and tiers adjusted this cadence take precedence over the records loaded before it. */
    private Mono<Void> runHallucinationTimers(List<ActorPresence> actors, Map<UUID, LucidityRecord> records,
                                              Map<UUID, AdjustmentResult> adjusted, Instant now) {
        return Flux.fromIterable(actors)
            .filter(actor -> currentTier(records, adjusted, actor.actorId()).isImpaired())
            .flatMap(actor -> store.getCooldown(actor.actorId(), HALLUCINATION_TIMER)
                .filter(timer -> timer.isActive(now))
                .hasElement()
                .flatMap(active -> active
                    ? Mono.<Void>empty()
                    : triggerHallucination(actor.actorId(), currentScore(records, adjusted, actor.actorId()), now))
                .onErrorResume(e -> {
                    log.warn("Hallucination timer check failed. actorId={} cause={}", actor.actorId(), e.toString());
                    return Mono.empty();
                }), Math.max(1, applyConcurrency))
            .then();
    }

    private Mono<Void> triggerHallucination(UUID actorId, int score, Instant now) {
        return store.setCooldown(actorId, HALLUCINATION_TIMER, now.plus(hallucinationInterval))
            .doOnNext(timer -> {
                log.info("Hallucination episode triggered. actorId={} nextAt={}", actorId, timer.expiresAt());
                try {
                    publisher.publishStatus(new LucidityStatusEvent(
                        actorId, score, "Shapes move at the edge of your vision.", LucidityStatus.HALLUCINATION));
                } catch (RuntimeException e) {
                    log.warn("Hallucination publish failed (non-critical). actorId={}", actorId, e);
                }
            })
            .then();
    }

    // ── world overrides ───────────────────────────────────────────────────────

    /** Loads drain-rate overrides once. Failure means "no overrides". */
    Mono<Void> loadWorldOverrides() {
        return ruleRepository.findAll()
            .collectList()
            .map(FluxScheduler::toOverrideTable)
            .doOnNext(table -> {
                resolver = resolver.withOverrides(table);
                log.info("World lucidity overrides loaded. rules={}", table.size());
            })
            .onErrorResume(e -> {
                log.warn("World lucidity overrides unavailable, using environment profiles only. cause={}",
                         e.toString());
                return Mono.empty();
            })
            .then();
    }

    private static WorldOverrideTable toOverrideTable(List<ZoneLucidityRuleEntity> rules) {
        WorldOverrideTable.Builder builder = WorldOverrideTable.builder();
        for (ZoneLucidityRuleEntity rule : rules) {
            if (rule.getDrainRate() == null || rule.getPlane() == null) {
                continue;
            }
            builder.drainRate(rule.getPlane(), rule.getZone(), rule.getSubZone(), rule.getDrainRate());
        }
        return builder.build();
    }

    int trackerCount() {
        return trackers.size();
    }

    FluxTracker tracker(UUID actorId) {
        return trackers.get(actorId);
    }

    // ── settings (tests) ──────────────────────────────────────────────────────

    void configure(int ticksPerCadence, int resistanceWindow, Duration hallucinationInterval) {
        this.ticksPerCadence       = ticksPerCadence;
        this.resistanceWindow      = resistanceWindow;
        this.hallucinationInterval = hallucinationInterval;
    }

    private record FluxPlan(UUID actorId, int delta, String roomId, Map<String, Object> metadata) {}

    /** {@code result} is null when the apply failed. */
    private record FluxOutcome(UUID actorId, AdjustmentResult result) {}
}
