package com.lucidityplatform.common.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.lucidityplatform.common.exception.UnknownActionCodeException;
import com.lucidityplatform.common.exception.UnknownEncounterCategoryException;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Static effect configuration: encounter categories, recovery rituals and the
 * liability codes that severe loss can attach. Loaded once at startup.
 */
public record EffectCatalog(
    @JsonProperty("encounters")  Map<String, EncounterProfile> encounters,
    @JsonProperty("recovery")    Map<String, RecoveryProfile> recovery,
    @JsonProperty("liabilities") List<String> liabilities
) {
    public EffectCatalog {
        encounters  = encounters == null ? Map.of() : Map.copyOf(encounters);
        recovery    = recovery == null ? Map.of() : Map.copyOf(recovery);
        liabilities = liabilities == null ? List.of() : List.copyOf(liabilities);
    }

    public EncounterProfile encounter(String category) {
        EncounterProfile profile = category == null ? null : encounters.get(normalize(category));
        if (profile == null) {
            throw new UnknownEncounterCategoryException(category);
        }
        return profile;
    }

    public RecoveryProfile recovery(String actionCode) {
        RecoveryProfile profile = actionCode == null ? null : recovery.get(normalize(actionCode));
        if (profile == null) {
            throw new UnknownActionCodeException(actionCode);
        }
        return profile;
    }

    public static String normalize(String code) {
        return code.trim().toLowerCase(Locale.ROOT);
    }
}
