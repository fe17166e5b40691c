package com.lucidityplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A stackable negative status carried by an actor after severe or worsening loss.
 */
public record Liability(
    @JsonProperty("code")   String code,
    @JsonProperty("stacks") int stacks
) {
    public Liability {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Liability code must not be blank");
        }
        stacks = Math.max(1, stacks);
    }

    public static Liability single(String code) {
        return new Liability(code, 1);
    }

    public Liability incremented() {
        return new Liability(code, stacks + 1);
    }

    public Liability decremented() {
        return new Liability(code, stacks - 1);
    }
}
