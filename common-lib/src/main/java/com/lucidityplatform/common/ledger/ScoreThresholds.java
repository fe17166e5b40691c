package com.lucidityplatform.common.ledger;

/**
 * Score bounds and the two threshold crossings evaluated on every adjustment.
 *
 * <p>The terminal-tier boundary (score ≤ 0) lives in
 * {@link com.lucidityplatform.common.tier.TierResolver}. The delirium threshold and
 * the absolute floor are separate, lower lines and are checked independently of any
 * tier change.
 */
public final class ScoreThresholds {

    public static final int MIN_SCORE = -100;
    public static final int MAX_SCORE = 100;

    /** Acute crisis: crossing it starts the external respawn flow. */
    public static final int DELIRIUM_THRESHOLD = -10;

    /** Absolute floor: crossing it triggers emergency relocation. */
    public static final int FLOOR_THRESHOLD = MIN_SCORE;

    private ScoreThresholds() {}

    public static int clamp(long value) {
        return (int) Math.max(MIN_SCORE, Math.min(MAX_SCORE, value));
    }

    public static boolean crossedDelirium(int previousScore, int newScore) {
        return newScore <= DELIRIUM_THRESHOLD && previousScore > DELIRIUM_THRESHOLD;
    }

    /** True only on the adjustment that reaches the floor, never while resting on it. */
    public static boolean crossedFloor(int previousScore, int newScore) {
        return newScore <= FLOOR_THRESHOLD && previousScore > FLOOR_THRESHOLD;
    }
}
