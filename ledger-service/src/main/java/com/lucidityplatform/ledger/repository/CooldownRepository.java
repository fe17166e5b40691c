package com.lucidityplatform.ledger.repository;

import com.lucidityplatform.ledger.model.CooldownEntity;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.UUID;

@Repository
public interface CooldownRepository extends ReactiveCrudRepository<CooldownEntity, Long> {

    Mono<CooldownEntity> findByActorIdAndActionCode(UUID actorId, String actionCode);

    /** Last write wins. */
    @Query("""
        INSERT INTO lucidity_cooldowns (actor_id, action_code, cooldown_expires_at)
        VALUES (:actorId, :actionCode, :expiresAt)
        ON CONFLICT (actor_id, action_code) DO UPDATE SET
            cooldown_expires_at = :expiresAt
        RETURNING *
        """)
    Mono<CooldownEntity> upsertCooldown(UUID actorId, String actionCode, Instant expiresAt);

    /** {@code pattern} is a LIKE pattern with {@code _} and {@code %} already escaped by the caller. */
    @Modifying
    @Query("DELETE FROM lucidity_cooldowns WHERE actor_id = :actorId AND action_code LIKE :pattern")
    Mono<Integer> deleteByActionCodeLike(UUID actorId, String pattern);
}
