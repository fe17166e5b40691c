package com.lucidityplatform.ledger.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;
import java.util.UUID;

/**
 * Read-only view of the character registry. Owned by the game server; this service
 * never writes it.
 */
@Data
@NoArgsConstructor
@Table("actors")
public class ActorPresenceEntity {

    @Id
    private UUID actorId;

    private String currentRoomId;
    private Instant lastActiveAt;
    private Instant createdAt;
    private Integer maxLucidity;
}
