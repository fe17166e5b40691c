package com.lucidityplatform.ledger.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;
import java.util.UUID;

/** Unique on (actor_id, action_code); overwritten on every use. */
@Data
@NoArgsConstructor
@Table("lucidity_cooldowns")
public class CooldownEntity {

    @Id
    private Long id;

    private UUID actorId;
    private String actionCode;
    private Instant cooldownExpiresAt;
}
