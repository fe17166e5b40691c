package com.lucidityplatform.ledger.repository;

import com.lucidityplatform.ledger.model.ExposureStateEntity;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.UUID;

@Repository
public interface ExposureStateRepository extends ReactiveCrudRepository<ExposureStateEntity, Long> {

    Mono<ExposureStateEntity> findByActorIdAndArchetype(UUID actorId, String archetype);

    /**
     * Atomic UPSERT: first exposure inserts count 1, later ones increment.
     * Returns the row after the write.
     */
    @Query("""
        INSERT INTO lucidity_exposure_state
            (actor_id, archetype, encounter_count, last_encounter_at)
        VALUES
            (:actorId, :archetype, 1, :encounteredAt)
        ON CONFLICT (actor_id, archetype) DO UPDATE SET
            encounter_count   = lucidity_exposure_state.encounter_count + 1,
            last_encounter_at = :encounteredAt
        RETURNING *
        """)
    Mono<ExposureStateEntity> incrementExposure(UUID actorId, String archetype, Instant encounteredAt);
}
