package com.lucidityplatform.ledger.repository;

import com.lucidityplatform.ledger.model.ActorPresenceEntity;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.time.Instant;
import java.util.UUID;

@Repository
public interface ActorPresenceRepository extends ReactiveCrudRepository<ActorPresenceEntity, UUID> {

    /** Recently active characters plus characters created in the last hour. */
    @Query("""
        SELECT * FROM actors
        WHERE last_active_at >= :activeSince
           OR created_at     >= :createdSince
        """)
    Flux<ActorPresenceEntity> findEligible(Instant activeSince, Instant createdSince);
}
