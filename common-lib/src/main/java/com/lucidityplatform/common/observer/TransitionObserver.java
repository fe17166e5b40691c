package com.lucidityplatform.common.observer;

import java.time.Instant;
import java.util.UUID;

/**
 * Subscriber to lucidity threshold transitions.
 *
 * <p>Injected into the adjustment engine at construction time. Callbacks run after the
 * adjustment has committed, on the caller's thread, so implementations must return
 * quickly and hand any slow work to their own scheduler. A throwing observer is logged
 * and skipped; it never undoes the adjustment.
 */
public interface TransitionObserver {

    /** The actor's score fell into the terminal tier (score ≤ 0). */
    void onCatatoniaEntered(UUID actorId, Instant enteredAt, int currentScore);

    /** The actor left the terminal tier. */
    void onCatatoniaCleared(UUID actorId, Instant resolvedAt);

    /** The actor reached the absolute floor (score -100) from above it. */
    void onFloorReached(UUID actorId, int currentScore);
}
