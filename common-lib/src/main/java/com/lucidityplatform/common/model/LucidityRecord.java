package com.lucidityplatform.common.model;

import com.lucidityplatform.common.tier.TierResolver;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Per-actor lucidity ledger row as seen by the domain.
 *
 * <p>Immutable: every mutation produces a new instance through one of the
 * {@code with*} methods so that the adjustment pipeline can compute the full
 * outcome before anything is written.
 *
 * @param actorId            owning actor
 * @param score              current score in [-100, 100]
 * @param tier               tier resolved from {@code score}
 * @param liabilities        ordered liability stacks, never null
 * @param catatoniaEnteredAt set while {@code tier == TERMINAL}, null otherwise
 * @param lastUpdatedAt      timestamp of the last write
 */
public record LucidityRecord(
    UUID actorId,
    int score,
    LucidityTier tier,
    List<Liability> liabilities,
    Instant catatoniaEnteredAt,
    Instant lastUpdatedAt
) {
    public static final int INITIAL_SCORE = 100;

    public LucidityRecord {
        liabilities = liabilities == null ? List.of() : List.copyOf(liabilities);
    }

    /** Record for an actor seen for the first time: full score, stable tier. */
    public static LucidityRecord fresh(UUID actorId, Instant now) {
        return new LucidityRecord(actorId, INITIAL_SCORE, TierResolver.resolve(INITIAL_SCORE),
                                  List.of(), null, now);
    }

    public LucidityRecord withScore(int newScore, LucidityTier newTier, Instant now) {
        return new LucidityRecord(actorId, newScore, newTier, liabilities, catatoniaEnteredAt, now);
    }

    public LucidityRecord withCatatoniaEnteredAt(Instant enteredAt) {
        return new LucidityRecord(actorId, score, tier, liabilities, enteredAt, lastUpdatedAt);
    }

    public LucidityRecord withLiabilities(List<Liability> updated, Instant now) {
        return new LucidityRecord(actorId, score, tier, updated, catatoniaEnteredAt, now);
    }

    public boolean isCatatonic() {
        return catatoniaEnteredAt != null;
    }
}
