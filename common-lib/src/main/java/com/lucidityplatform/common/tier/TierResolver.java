package com.lucidityplatform.common.tier;

import com.lucidityplatform.common.model.LucidityTier;

/**
 * Maps a lucidity score onto its {@link LucidityTier}.
 *
 * <pre>
 *   score ≥ 70 → STABLE
 *   score ≥ 40 → UNEASY
 *   score ≥ 20 → FRACTURED
 *   score ≥ 1  → DERANGED
 *   otherwise  → TERMINAL
 * </pre>
 *
 * <p>Total over every int, not only the clamped range. Stateless and thread-safe.
 */
public final class TierResolver {

    public static final int STABLE_FLOOR    = 70;
    public static final int UNEASY_FLOOR    = 40;
    public static final int FRACTURED_FLOOR = 20;
    public static final int DERANGED_FLOOR  = 1;

    private TierResolver() {}

    public static LucidityTier resolve(int score) {
        if (score >= STABLE_FLOOR)    return LucidityTier.STABLE;
        if (score >= UNEASY_FLOOR)    return LucidityTier.UNEASY;
        if (score >= FRACTURED_FLOOR) return LucidityTier.FRACTURED;
        if (score >= DERANGED_FLOOR)  return LucidityTier.DERANGED;
        return LucidityTier.TERMINAL;
    }
}
