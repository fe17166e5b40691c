package com.lucidityplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Discrete stability band derived from an actor's lucidity score.
 *
 * <p>Declaration order is severity order: {@link #STABLE} is the healthiest band and
 * {@link #TERMINAL} the worst. {@link #isWorseThan(LucidityTier)} relies on it.
 */
public enum LucidityTier {
    STABLE("stable"),
    UNEASY("uneasy"),
    FRACTURED("fractured"),
    DERANGED("deranged"),
    TERMINAL("terminal");

    private final String label;

    LucidityTier(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /** Deranged and terminal actors destabilise the people around them. */
    public boolean isImpaired() {
        return this == DERANGED || this == TERMINAL;
    }

    public boolean isWorseThan(LucidityTier other) {
        return ordinal() > other.ordinal();
    }

    @JsonCreator
    public static LucidityTier fromLabel(String label) {
        if (label == null) {
            throw new IllegalArgumentException("Tier label must not be null");
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        for (LucidityTier tier : values()) {
            if (tier.label.equals(normalized)) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown lucidity tier: " + label);
    }
}
