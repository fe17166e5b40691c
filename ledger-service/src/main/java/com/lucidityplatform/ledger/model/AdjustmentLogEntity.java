package com.lucidityplatform.ledger.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;
import java.util.UUID;

/** Append-only audit trail. Rows are inserted and never updated. */
@Data
@NoArgsConstructor
@Table("lucidity_adjustment_log")
public class AdjustmentLogEntity {

    @Id
    private Long id;

    private UUID actorId;
    private int delta;
    private String reasonCode;
    private String metadata;
    private String locationId;
    private Instant createdAt;
}
