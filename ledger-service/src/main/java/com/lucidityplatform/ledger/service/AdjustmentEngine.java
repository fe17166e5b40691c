package com.lucidityplatform.ledger.service;

import com.lucidityplatform.common.event.LucidityChangeEvent;
import com.lucidityplatform.common.event.LucidityEventPublisher;
import com.lucidityplatform.common.event.LucidityStatus;
import com.lucidityplatform.common.event.LucidityStatusEvent;
import com.lucidityplatform.common.ledger.LiabilityRoller;
import com.lucidityplatform.common.ledger.ScoreThresholds;
import com.lucidityplatform.common.model.ActorPresence;
import com.lucidityplatform.common.model.AdjustmentLogEntry;
import com.lucidityplatform.common.model.AdjustmentResult;
import com.lucidityplatform.common.model.Liability;
import com.lucidityplatform.common.model.LucidityRecord;
import com.lucidityplatform.common.model.LucidityTier;
import com.lucidityplatform.common.observer.TransitionObserver;
import com.lucidityplatform.common.tier.TierResolver;
import com.lucidityplatform.ledger.store.LedgerStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * The single write path for lucidity scores.
 *
 * <p>Each adjustment runs in two phases:
 * <pre>
 *   1. inside the actor transaction: plan → evaluate (pure) → persist record + log entry → follow-up writes
 *   2. after commit:                 observers → status events → state-change event
 * </pre>
 * Phase 2 is best-effort. A failing observer or publisher is logged and skipped; the
 * caller still receives the committed {@link AdjustmentResult}.
 *
 * <p>The terminal tier (score ≤ 0), the delirium threshold (≤ -10) and the absolute
 * floor (-100) are evaluated independently on every adjustment.
 */
@Service
public class AdjustmentEngine {

    private static final Logger log = LoggerFactory.getLogger(AdjustmentEngine.class);

    static final String REASON_LIABILITY_CLEARED = "liability_cleared";

    private final LedgerStore store;
    private final LiabilityRoller liabilityRoller;
    private final List<TransitionObserver> observers;
    private final LucidityEventPublisher publisher;
    private final Clock clock;

    public AdjustmentEngine(LedgerStore store,
                            LiabilityRoller liabilityRoller,
                            List<TransitionObserver> observers,
                            LucidityEventPublisher publisher,
                            Clock clock) {
        this.store           = store;
        this.liabilityRoller = liabilityRoller;
        this.observers       = List.copyOf(observers);
        this.publisher       = publisher;
        this.clock           = clock;
    }

    public Mono<AdjustmentResult> apply(UUID actorId, int delta, String reasonCode) {
        return apply(actorId, delta, reasonCode, null, null);
    }

    /**
     * Applies {@code delta} to the actor's score.
     *
     * @param metadata   free-form context stored on the log entry and echoed on the event; may be null
     * @param locationId room the adjustment happened in; may be null
     */
    public Mono<AdjustmentResult> apply(UUID actorId, int delta, String reasonCode,
                                        Map<String, Object> metadata, String locationId) {
        return apply(actorId, reasonCode, locationId,
                     Mono.fromSupplier(() -> new PlannedAdjustment(delta, metadata)),
                     result -> Mono.empty());
    }

    /**
     * Applies an adjustment whose delta is decided under the actor lock.
     *
     * <p>{@code plan} runs first and {@code followUp} after the record is saved, both
     * inside the actor transaction: their writes commit or roll back together with the
     * score. An error from either aborts the whole adjustment.
     */
    public Mono<AdjustmentResult> apply(UUID actorId, String reasonCode, String locationId,
                                        Mono<PlannedAdjustment> plan,
                                        Function<AdjustmentResult, Mono<Void>> followUp) {
        return store.inActorTransaction(actorId, current -> plan.flatMap(planned -> {
                Instant now = clock.instant();
                Evaluation evaluation = evaluate(current, planned.delta(), now);
                AdjustmentLogEntry entry = new AdjustmentLogEntry(
                    actorId, planned.delta(), reasonCode, planned.metadata(), locationId, now);
                return store.saveAdjustment(evaluation.updated(), entry)
                    .then(Mono.defer(() -> followUp.apply(evaluation.result())))
                    .thenReturn(new Committed(evaluation, planned.metadata()));
            }))
            .doOnNext(committed -> log.info(
                "Lucidity adjustment applied. actorId={} delta={} reason={} score={}->{} tier={}->{} liabilitiesAdded={}",
                actorId, committed.result().delta(), reasonCode,
                committed.result().previousScore(), committed.result().newScore(),
                committed.result().previousTier().label(), committed.result().newTier().label(),
                committed.result().liabilitiesAdded()))
            .flatMap(committed -> afterCommit(committed.evaluation(), reasonCode, committed.metadata(), locationId)
                .thenReturn(committed.result()));
    }

    /**
     * Removes one stack of {@code code}, or the whole entry when {@code removeAll} is set.
     * Persisted with a zero-delta log entry; emits {@code false} when the actor does not
     * carry the liability.
     */
    public Mono<Boolean> clearLiability(UUID actorId, String code, boolean removeAll) {
        return store.inActorTransaction(actorId, current -> {
            List<Liability> reduced = LiabilityRoller.reduce(current.liabilities(), code, removeAll);
            if (reduced.equals(current.liabilities())) {
                return Mono.just(false);
            }
            Instant now = clock.instant();
            AdjustmentLogEntry entry = new AdjustmentLogEntry(
                actorId, 0, REASON_LIABILITY_CLEARED,
                Map.of("liability_code", code, "remove_all", removeAll), null, now);
            return store.saveAdjustment(current.withLiabilities(reduced, now), entry).thenReturn(true);
        })
        .doOnNext(changed -> log.info("Liability clear requested. actorId={} code={} removeAll={} changed={}",
                                      actorId, code, removeAll, changed));
    }

    public Mono<LucidityRecord> getRecord(UUID actorId) {
        return store.getOrCreate(actorId);
    }

    // ── phase 1: pure evaluation ──────────────────────────────────────────────

    Evaluation evaluate(LucidityRecord current, int delta, Instant now) {
        int previousScore = current.score();
        LucidityTier previousTier = current.tier();
        int newScore = ScoreThresholds.clamp((long) previousScore + delta);
        LucidityTier newTier = TierResolver.resolve(newScore);

        LucidityRecord updated = current.withScore(newScore, newTier, now);

        boolean enteredCatatonia = newTier == LucidityTier.TERMINAL && !current.isCatatonic();
        boolean clearedCatatonia = newTier != LucidityTier.TERMINAL && current.isCatatonic();
        if (enteredCatatonia) {
            updated = updated.withCatatoniaEnteredAt(now);
        } else if (clearedCatatonia) {
            updated = updated.withCatatoniaEnteredAt(null);
        }

        Optional<String> rolled = liabilityRoller.roll(current.liabilities(), delta, previousTier, newTier);
        if (rolled.isPresent()) {
            updated = updated.withLiabilities(LiabilityRoller.stack(current.liabilities(), rolled.get()), now);
        }

        AdjustmentResult result = new AdjustmentResult(
            current.actorId(), previousScore, newScore, previousTier, newTier, delta,
            rolled.map(code -> List.of(code)).orElse(List.of()));

        return new Evaluation(updated, result, enteredCatatonia, clearedCatatonia,
                              ScoreThresholds.crossedDelirium(previousScore, newScore),
                              ScoreThresholds.crossedFloor(previousScore, newScore));
    }

    // ── phase 2: side effects ─────────────────────────────────────────────────

    private Mono<Void> afterCommit(Evaluation evaluation, String reasonCode,
                                   Map<String, Object> metadata, String locationId) {
        UUID actorId = evaluation.result().actorId();
        int score = evaluation.result().newScore();
        Instant now = evaluation.updated().lastUpdatedAt();

        if (evaluation.enteredCatatonia()) {
            notifyObservers("onCatatoniaEntered", actorId, o -> o.onCatatoniaEntered(actorId, now, score));
            publishStatus(actorId, score, LucidityStatus.CATATONIC,
                          "Your senses dissolve into static. Only allies can reach you now.");
        }
        if (evaluation.clearedCatatonia()) {
            notifyObservers("onCatatoniaCleared", actorId, o -> o.onCatatoniaCleared(actorId, now));
            publishStatus(actorId, score, LucidityStatus.SUCCESS,
                          "The grounding takes hold and your mind steadies.");
        }
        if (evaluation.crossedDelirium()) {
            publishStatus(actorId, score, LucidityStatus.DELIRIUM,
                          "Your mind gives way entirely. The sanitarium pulls you back from the brink.");
        }
        if (evaluation.crossedFloor()) {
            notifyObservers("onFloorReached", actorId, o -> o.onFloorReached(actorId, score));
            publishStatus(actorId, score, LucidityStatus.SANITARIUM,
                          "Orderlies carry you to the sanitarium for observation.");
        }

        if (evaluation.result().delta() == 0 && !evaluation.result().tierChanged()) {
            return Mono.empty();
        }
        return store.findMaxScore(actorId)
            .onErrorResume(e -> {
                log.warn("Max lucidity lookup failed, using default. actorId={} cause={}", actorId, e.toString());
                return Mono.just(ActorPresence.DEFAULT_MAX_SCORE);
            })
            .defaultIfEmpty(ActorPresence.DEFAULT_MAX_SCORE)
            .doOnNext(maxScore -> publishChange(evaluation, maxScore, reasonCode, metadata, locationId))
            .then();
    }

    private void notifyObservers(String callback, UUID actorId, Consumer<TransitionObserver> call) {
        for (TransitionObserver observer : observers) {
            try {
                call.accept(observer);
            } catch (RuntimeException e) {
                log.error("Transition observer failed. callback={} observer={} actorId={}",
                          callback, observer.getClass().getSimpleName(), actorId, e);
            }
        }
    }

    private void publishStatus(UUID actorId, int score, LucidityStatus status, String message) {
        try {
            publisher.publishStatus(new LucidityStatusEvent(actorId, score, message, status));
        } catch (RuntimeException e) {
            log.warn("Lucidity status publish failed (non-critical). actorId={} status={}",
                     actorId, status.code(), e);
        }
    }

    private void publishChange(Evaluation evaluation, int maxScore, String reasonCode,
                               Map<String, Object> metadata, String locationId) {
        AdjustmentResult result = evaluation.result();
        LucidityChangeEvent event = new LucidityChangeEvent(
            result.actorId(),
            Math.min(result.newScore(), maxScore),
            maxScore,
            result.delta(),
            result.newTier(),
            evaluation.updated().liabilities(),
            reasonCode,
            resolveSource(metadata, locationId),
            metadata
        );
        try {
            publisher.publishChange(event);
        } catch (RuntimeException e) {
            log.warn("Lucidity change publish failed (non-critical). actorId={}", result.actorId(), e);
        }
    }

    /** Most specific origin: metadata source → encounter category → environment → location. */
    static String resolveSource(Map<String, Object> metadata, String locationId) {
        for (String key : List.of("source", "encounter_category", "environment")) {
            Object value = metadata.get(key);
            if (value != null && !value.toString().isBlank()) {
                return value.toString();
            }
        }
        return locationId;
    }

    private record Committed(Evaluation evaluation, Map<String, Object> metadata) {

        AdjustmentResult result() {
            return evaluation.result();
        }
    }

    record Evaluation(
        LucidityRecord updated,
        AdjustmentResult result,
        boolean enteredCatatonia,
        boolean clearedCatatonia,
        boolean crossedDelirium,
        boolean crossedFloor
    ) {}
}
