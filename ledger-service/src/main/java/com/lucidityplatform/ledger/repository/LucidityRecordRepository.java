package com.lucidityplatform.ledger.repository;

import com.lucidityplatform.ledger.model.LucidityRecordEntity;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Collection;
import java.util.UUID;

@Repository
public interface LucidityRecordRepository extends ReactiveCrudRepository<LucidityRecordEntity, UUID> {

    /**
     * Creates the default record (score 100, stable) for a registered actor.
     * No-op when the record exists or the actor is not in the registry, so the
     * returned count is 0 in both cases.
     */
    @Modifying
    @Query("""
        INSERT INTO player_lucidity
            (actor_id, score, tier, liabilities, catatonia_entered_at, last_updated_at)
        SELECT a.actor_id, 100, 'stable', '[]', NULL, NOW()
        FROM actors a
        WHERE a.actor_id = :actorId
        ON CONFLICT (actor_id) DO NOTHING
        """)
    Mono<Integer> ensureRecord(UUID actorId);

    /** Row lock held until the surrounding transaction ends. */
    @Query("SELECT * FROM player_lucidity WHERE actor_id = :actorId FOR UPDATE")
    Mono<LucidityRecordEntity> lockByActorId(UUID actorId);

    @Modifying
    @Query("""
        UPDATE player_lucidity SET
            score                = :score,
            tier                 = :tier,
            liabilities          = :liabilities,
            catatonia_entered_at = :catatoniaEnteredAt,
            last_updated_at      = :lastUpdatedAt
        WHERE actor_id = :actorId
        """)
    Mono<Integer> updateRecord(UUID actorId, int score, String tier, String liabilities,
                               Instant catatoniaEnteredAt, Instant lastUpdatedAt);

    Flux<LucidityRecordEntity> findByActorIdIn(Collection<UUID> actorIds);
}
