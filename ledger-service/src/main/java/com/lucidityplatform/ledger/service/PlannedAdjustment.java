package com.lucidityplatform.ledger.service;

import java.util.Map;

/** Delta and log metadata decided inside the actor transaction. */
public record PlannedAdjustment(int delta, Map<String, Object> metadata) {

    public PlannedAdjustment {
        metadata = metadata == null ? Map.of() : metadata;
    }
}
