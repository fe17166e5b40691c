package com.lucidityplatform.common.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Lucidity loss for one encounter category.
 *
 * @param firstTime delta applied on the first exposure to an archetype
 * @param repeat    delta applied on later exposures, halved once acclimated
 */
public record EncounterProfile(
    @JsonProperty("firstTime") int firstTime,
    @JsonProperty("repeat")    int repeat
) {
    public static final int DEFAULT_ACCLIMATION_THRESHOLD = 6;

    /**
     * Resolves the delta for the {@code encounterCount}-th exposure (1-based).
     *
     * <p>Once acclimated the repeat penalty is halved toward zero, but a negative
     * penalty never rounds away completely: {@code -1 / 2} becomes {@code -1}.
     */
    public int deltaFor(int encounterCount, int acclimationThreshold) {
        if (encounterCount <= 1) {
            return firstTime;
        }
        if (encounterCount >= acclimationThreshold) {
            int halved = repeat / 2;
            if (halved == 0 && repeat < 0) {
                return -1;
            }
            return halved;
        }
        return repeat;
    }

    public boolean isAcclimated(int encounterCount, int acclimationThreshold) {
        return encounterCount > 1 && encounterCount >= acclimationThreshold;
    }
}
