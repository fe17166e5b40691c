package com.lucidityplatform.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.lucidityplatform.common.model.Liability;
import com.lucidityplatform.common.model.LucidityTier;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * State-change notification pushed to the actor's client after an adjustment.
 *
 * @param score    current score capped to {@code maxScore}
 * @param source   most specific origin found in the metadata, or the location id
 */
public record LucidityChangeEvent(
    @JsonProperty("actorId")     UUID actorId,
    @JsonProperty("score")       int score,
    @JsonProperty("maxScore")    int maxScore,
    @JsonProperty("delta")       int delta,
    @JsonProperty("tier")        LucidityTier tier,
    @JsonProperty("liabilities") List<Liability> liabilities,
    @JsonProperty("reason")      String reason,
    @JsonProperty("source")      String source,
    @JsonProperty("metadata")    Map<String, Object> metadata
) {}
