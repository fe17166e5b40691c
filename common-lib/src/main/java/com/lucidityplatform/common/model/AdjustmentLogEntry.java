package com.lucidityplatform.common.model;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only audit row written together with every applied adjustment.
 */
public record AdjustmentLogEntry(
    UUID actorId,
    int delta,
    String reasonCode,
    Map<String, Object> metadata,
    String locationId,
    Instant createdAt
) {
    public AdjustmentLogEntry {
        metadata = metadata == null ? Map.of() : metadata;
    }
}
