package com.lucidityplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/** Cooldown view handed to callers that need to phrase "try again in …" messages. */
public record CooldownStatus(
    @JsonProperty("actionCode")       String actionCode,
    @JsonProperty("active")           boolean active,
    @JsonProperty("expiresAt")        Instant expiresAt,
    @JsonProperty("remainingSeconds") long remainingSeconds
) {
    public static CooldownStatus available(String actionCode) {
        return new CooldownStatus(actionCode, false, null, 0L);
    }

    public static CooldownStatus of(CooldownRecord record, Instant now) {
        return new CooldownStatus(record.actionCode(), record.isActive(now),
                                  record.expiresAt(), record.remaining(now).toSeconds());
    }
}
