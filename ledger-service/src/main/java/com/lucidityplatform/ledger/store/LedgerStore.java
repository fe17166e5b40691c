package com.lucidityplatform.ledger.store;

import com.lucidityplatform.common.model.ActorPresence;
import com.lucidityplatform.common.model.AdjustmentLogEntry;
import com.lucidityplatform.common.model.CooldownRecord;
import com.lucidityplatform.common.model.ExposureState;
import com.lucidityplatform.common.model.LucidityRecord;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Collection;
import java.util.UUID;
import java.util.function.Function;

/**
 * Durable lucidity state.
 *
 * <p>Every method fails with {@link com.lucidityplatform.common.exception.StorageException}
 * on driver errors or timeouts and with
 * {@link com.lucidityplatform.common.exception.ActorNotFoundException} when the actor is
 * not in the character registry. Domain exceptions raised by {@code work} in
 * {@link #inActorTransaction} propagate unchanged.
 */
public interface LedgerStore {

    /** Loads the record, creating the default one (score 100) on first access. */
    Mono<LucidityRecord> getOrCreate(UUID actorId);

    /**
     * Runs {@code work} against the actor's record while holding the per-actor lock.
     * Writes made through this store inside {@code work} (record, log entry, exposure,
     * cooldowns) commit together when the returned {@code Mono} completes and roll back
     * when it errors.
     */
    <T> Mono<T> inActorTransaction(UUID actorId, Function<LucidityRecord, Mono<T>> work);

    /** Persists the updated record and its log entry. Call inside {@link #inActorTransaction}. */
    Mono<Void> saveAdjustment(LucidityRecord record, AdjustmentLogEntry entry);

    Mono<ExposureState> getExposure(UUID actorId, String archetype);

    /** Atomically increments and returns the new exposure state. */
    Mono<ExposureState> incrementExposure(UUID actorId, String archetype, Instant encounteredAt);

    Mono<CooldownRecord> getCooldown(UUID actorId, String actionCode);

    Mono<CooldownRecord> setCooldown(UUID actorId, String actionCode, Instant expiresAt);

    /** Deletes every cooldown whose action code starts with {@code prefix}; emits the count. */
    Mono<Integer> deleteCooldowns(UUID actorId, String prefix);

    Flux<ActorPresence> listActiveActors(Instant activeSince, Instant createdSince);

    /** Existing records only; actors without one are simply absent. */
    Flux<LucidityRecord> findRecords(Collection<UUID> actorIds);

    /** The actor's lucidity ceiling, {@link ActorPresence#DEFAULT_MAX_SCORE} when unset. */
    Mono<Integer> findMaxScore(UUID actorId);
}
