package com.lucidityplatform.ledger.support;

import com.lucidityplatform.common.exception.ActorNotFoundException;
import com.lucidityplatform.common.exception.StorageException;
import com.lucidityplatform.common.model.ActorPresence;
import com.lucidityplatform.common.model.AdjustmentLogEntry;
import com.lucidityplatform.common.model.CooldownRecord;
import com.lucidityplatform.common.model.ExposureState;
import com.lucidityplatform.common.model.Liability;
import com.lucidityplatform.common.model.LucidityRecord;
import com.lucidityplatform.common.tier.TierResolver;
import com.lucidityplatform.ledger.store.LedgerStore;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * {@link LedgerStore} fake with rollback on error and failure injection.
 * Not safe for concurrent transactions on the same actor.
 */
public class InMemoryLedgerStore implements LedgerStore {

    private final Clock clock;

    private final Map<UUID, ActorPresence>  actors    = new ConcurrentHashMap<>();
    private final Map<UUID, LucidityRecord> records   = new ConcurrentHashMap<>();
    private final Map<String, ExposureState>  exposures = new ConcurrentHashMap<>();
    private final Map<String, CooldownRecord> cooldowns = new ConcurrentHashMap<>();
    private final List<AdjustmentLogEntry>  logEntries = new ArrayList<>();
    private final Set<UUID> failingActors = ConcurrentHashMap.newKeySet();

    private volatile boolean failWrites;
    private volatile boolean failCooldownWrites;

    public InMemoryLedgerStore(Clock clock) {
        this.clock = clock;
    }

    // ── fixture setup ─────────────────────────────────────────────────────────

    public UUID registerActor() {
        return registerActor(null, ActorPresence.DEFAULT_MAX_SCORE);
    }

    public UUID registerActor(String roomId, int maxScore) {
        UUID actorId = UUID.randomUUID();
        Instant now = clock.instant();
        actors.put(actorId, new ActorPresence(actorId, roomId, now, now.minusSeconds(86_400), maxScore));
        return actorId;
    }

    public void updatePresence(ActorPresence presence) {
        actors.put(presence.actorId(), presence);
    }

    public ActorPresence presence(UUID actorId) {
        return actors.get(actorId);
    }

    public void seed(UUID actorId, int score, List<Liability> liabilities) {
        Instant now = clock.instant();
        records.put(actorId, new LucidityRecord(actorId, score, TierResolver.resolve(score), liabilities,
                                                score <= 0 ? now : null, now));
    }

    public void seed(UUID actorId, int score) {
        seed(actorId, score, List.of());
    }

    public void failWrites(boolean fail) {
        this.failWrites = fail;
    }

    public void failCooldownWrites(boolean fail) {
        this.failCooldownWrites = fail;
    }

    public void failWritesFor(UUID actorId) {
        failingActors.add(actorId);
    }

    // ── inspection ────────────────────────────────────────────────────────────

    public LucidityRecord record(UUID actorId) {
        return records.get(actorId);
    }

    public synchronized List<AdjustmentLogEntry> logEntries() {
        return List.copyOf(logEntries);
    }

    // ── LedgerStore ───────────────────────────────────────────────────────────

    @Override
    public Mono<LucidityRecord> getOrCreate(UUID actorId) {
        return Mono.fromCallable(() -> load(actorId));
    }

    @Override
    public <T> Mono<T> inActorTransaction(UUID actorId, Function<LucidityRecord, Mono<T>> work) {
        return Mono.defer(() -> {
            LucidityRecord current = load(actorId);
            int logSize = logEntries().size();
            Map<String, ExposureState> exposureSnapshot = snapshot(exposures, actorId);
            Map<String, CooldownRecord> cooldownSnapshot = snapshot(cooldowns, actorId);
            return work.apply(current)
                .doOnError(e -> {
                    rollback(actorId, current, logSize);
                    restore(exposures, actorId, exposureSnapshot);
                    restore(cooldowns, actorId, cooldownSnapshot);
                });
        });
    }

    @Override
    public Mono<Void> saveAdjustment(LucidityRecord record, AdjustmentLogEntry entry) {
        if (failWrites || failingActors.contains(record.actorId())) {
            return Mono.error(new StorageException("saveAdjustment", new IllegalStateException("injected failure")));
        }
        return Mono.fromRunnable(() -> {
            records.put(record.actorId(), record);
            synchronized (this) {
                logEntries.add(entry);
            }
        });
    }

    @Override
    public Mono<ExposureState> getExposure(UUID actorId, String archetype) {
        return Mono.justOrEmpty(exposures.get(key(actorId, archetype)));
    }

    @Override
    public Mono<ExposureState> incrementExposure(UUID actorId, String archetype, Instant encounteredAt) {
        return Mono.fromCallable(() -> exposures.merge(key(actorId, archetype),
            new ExposureState(actorId, archetype, 1, encounteredAt),
            (old, fresh) -> new ExposureState(actorId, archetype, old.encounterCount() + 1, encounteredAt)));
    }

    @Override
    public Mono<CooldownRecord> getCooldown(UUID actorId, String actionCode) {
        return Mono.justOrEmpty(cooldowns.get(key(actorId, actionCode)));
    }

    @Override
    public Mono<CooldownRecord> setCooldown(UUID actorId, String actionCode, Instant expiresAt) {
        return Mono.fromCallable(() -> {
            if (failCooldownWrites) {
                throw new StorageException("setCooldown", new IllegalStateException("injected failure"));
            }
            CooldownRecord cooldown = new CooldownRecord(actorId, actionCode, expiresAt);
            cooldowns.put(key(actorId, actionCode), cooldown);
            return cooldown;
        });
    }

    @Override
    public Mono<Integer> deleteCooldowns(UUID actorId, String prefix) {
        return Mono.fromCallable(() -> {
            String keyPrefix = key(actorId, prefix);
            Set<String> doomed = new HashSet<>();
            for (String key : cooldowns.keySet()) {
                if (key.startsWith(keyPrefix)) {
                    doomed.add(key);
                }
            }
            doomed.forEach(cooldowns::remove);
            return doomed.size();
        });
    }

    @Override
    public Flux<ActorPresence> listActiveActors(Instant activeSince, Instant createdSince) {
        return Flux.fromIterable(new ArrayList<>(actors.values()))
            .filter(a -> (a.lastActiveAt() != null && !a.lastActiveAt().isBefore(activeSince))
                      || (a.createdAt() != null && !a.createdAt().isBefore(createdSince)));
    }

    @Override
    public Flux<LucidityRecord> findRecords(Collection<UUID> actorIds) {
        return Flux.fromIterable(actorIds)
            .mapNotNull(records::get);
    }

    @Override
    public Mono<Integer> findMaxScore(UUID actorId) {
        return Mono.fromCallable(() -> {
            ActorPresence actor = actors.get(actorId);
            if (actor == null) {
                throw new ActorNotFoundException(actorId);
            }
            return actor.maxScore();
        });
    }

    // ── internals ─────────────────────────────────────────────────────────────

    private LucidityRecord load(UUID actorId) {
        if (!actors.containsKey(actorId)) {
            throw new ActorNotFoundException(actorId);
        }
        return records.computeIfAbsent(actorId, id -> LucidityRecord.fresh(id, clock.instant()));
    }

    private synchronized void rollback(UUID actorId, LucidityRecord snapshot, int logSize) {
        records.put(actorId, snapshot);
        while (logEntries.size() > logSize) {
            logEntries.remove(logEntries.size() - 1);
        }
    }

    private static <V> Map<String, V> snapshot(Map<String, V> source, UUID actorId) {
        Map<String, V> copy = new HashMap<>();
        source.forEach((key, value) -> {
            if (key.startsWith(actorId + "|")) {
                copy.put(key, value);
            }
        });
        return copy;
    }

    private static <V> void restore(Map<String, V> target, UUID actorId, Map<String, V> snapshot) {
        target.keySet().removeIf(key -> key.startsWith(actorId + "|"));
        target.putAll(snapshot);
    }

    private static String key(UUID actorId, String code) {
        return actorId + "|" + code;
    }
}
