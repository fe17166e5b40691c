package com.lucidityplatform.common.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/** Gain and rate limit of one recovery ritual. */
public record RecoveryProfile(
    @JsonProperty("delta")    int delta,
    @JsonProperty("cooldown") Duration cooldown
) {}
