package com.lucidityplatform.common.flux;

import com.lucidityplatform.common.model.LucidityTier;

import java.util.Collection;

/**
 * Flux contribution of co-located actors.
 *
 * <p>Each non-impaired companion adds {@value #PER_COMPANION_BONUS}, capped at
 * {@value #MAX_BONUS}; a single impaired companion subtracts {@value #IMPAIRED_PENALTY}
 * regardless of how many are impaired.
 */
public final class CompanionModifier {

    public static final double PER_COMPANION_BONUS = 0.1;
    public static final double MAX_BONUS           = 0.3;
    public static final double IMPAIRED_PENALTY    = 0.2;

    private CompanionModifier() {}

    /** Companions without a record should be passed as {@link LucidityTier#STABLE}. */
    public static double compute(Collection<LucidityTier> companionTiers) {
        if (companionTiers == null || companionTiers.isEmpty()) {
            return 0.0;
        }
        int supportive = 0;
        boolean anyImpaired = false;
        for (LucidityTier tier : companionTiers) {
            if (tier != null && tier.isImpaired()) {
                anyImpaired = true;
            } else {
                supportive++;
            }
        }
        double modifier = Math.min(MAX_BONUS, supportive * PER_COMPANION_BONUS);
        if (anyImpaired) {
            modifier -= IMPAIRED_PENALTY;
        }
        return modifier;
    }
}
