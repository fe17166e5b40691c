package com.lucidityplatform.ledger.job;

/**
 * Outcome of one scheduler tick.
 *
 * @param evaluated   eligible actors considered this cadence
 * @param adjustments non-zero deltas applied successfully
 * @param skipped     actors with no current room
 * @param failed      adjustments that raised and were logged
 */
public record FluxTickSummary(
    long tick,
    boolean cadence,
    int evaluated,
    int adjustments,
    int skipped,
    int failed
) {
    public static FluxTickSummary idle(long tick) {
        return new FluxTickSummary(tick, false, 0, 0, 0, 0);
    }
}
