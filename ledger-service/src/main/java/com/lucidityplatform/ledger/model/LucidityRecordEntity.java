package com.lucidityplatform.ledger.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;
import java.util.UUID;

/**
 * One row per actor. {@code liabilities} is a JSON array of {@code {code, stacks}}.
 * Written only through {@code LucidityRecordRepository.updateRecord} inside an
 * actor transaction.
 */
@Data
@NoArgsConstructor
@Table("player_lucidity")
public class LucidityRecordEntity {

    @Id
    private UUID actorId;

    private int score;
    private String tier;
    private String liabilities;

    private Instant catatoniaEnteredAt;
    private Instant lastUpdatedAt;
}
