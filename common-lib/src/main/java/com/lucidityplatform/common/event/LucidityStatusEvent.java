package com.lucidityplatform.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

/**
 * Threshold notification: terminal-tier entry, rescue from it, acute crisis,
 * absolute floor or a hallucination episode.
 */
public record LucidityStatusEvent(
    @JsonProperty("actorId") UUID actorId,
    @JsonProperty("score")   int score,
    @JsonProperty("message") String message,
    @JsonProperty("status")  LucidityStatus status
) {}
