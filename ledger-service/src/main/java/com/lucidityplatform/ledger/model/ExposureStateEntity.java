package com.lucidityplatform.ledger.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;
import java.util.UUID;

/** Unique on (actor_id, archetype). */
@Data
@NoArgsConstructor
@Table("lucidity_exposure_state")
public class ExposureStateEntity {

    @Id
    private Long id;

    private UUID actorId;
    private String archetype;
    private int encounterCount;
    private Instant lastEncounterAt;
}
