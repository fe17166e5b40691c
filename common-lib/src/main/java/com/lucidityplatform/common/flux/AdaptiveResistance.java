package com.lucidityplatform.common.flux;

/**
 * Dampens negative flux for actors who stay in one room. Positive flux is untouched.
 *
 * <p>{@code steps = min((cadencesInRoom - 1) / window, 2)}, multiplier
 * {@code max(0.5, 1 - 0.25 * steps)}.
 */
public final class AdaptiveResistance {

    public static final int    DEFAULT_WINDOW  = 10;
    public static final int    MAX_STEPS       = 2;
    public static final double STEP_REDUCTION  = 0.25;
    public static final double MIN_MULTIPLIER  = 0.5;

    private AdaptiveResistance() {}

    public static double apply(double flux, int cadencesInRoom, int window) {
        if (flux >= 0) {
            return flux;
        }
        return flux * multiplier(cadencesInRoom, window);
    }

    public static double multiplier(int cadencesInRoom, int window) {
        int effectiveWindow = Math.max(1, window);
        int steps = Math.min(Math.max(0, cadencesInRoom - 1) / effectiveWindow, MAX_STEPS);
        return Math.max(MIN_MULTIPLIER, 1.0 - STEP_REDUCTION * steps);
    }
}
