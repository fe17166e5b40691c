package com.lucidityplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.UUID;

/**
 * Normalized outcome of a single lucidity adjustment.
 */
public record AdjustmentResult(
    @JsonProperty("actorId")          UUID actorId,
    @JsonProperty("previousScore")    int previousScore,
    @JsonProperty("newScore")         int newScore,
    @JsonProperty("previousTier")     LucidityTier previousTier,
    @JsonProperty("newTier")          LucidityTier newTier,
    @JsonProperty("delta")            int delta,
    @JsonProperty("liabilitiesAdded") List<String> liabilitiesAdded
) {
    public AdjustmentResult {
        liabilitiesAdded = liabilitiesAdded == null ? List.of() : List.copyOf(liabilitiesAdded);
    }

    public boolean tierChanged() {
        return previousTier != newTier;
    }
}
