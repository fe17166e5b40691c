package com.lucidityplatform.ledger.service;

import com.lucidityplatform.common.catalog.EffectCatalog;
import com.lucidityplatform.common.catalog.EncounterProfile;
import com.lucidityplatform.common.catalog.RecoveryProfile;
import com.lucidityplatform.common.exception.OnCooldownException;
import com.lucidityplatform.common.model.AdjustmentResult;
import com.lucidityplatform.common.model.CooldownStatus;
import com.lucidityplatform.ledger.store.LedgerStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Catalog-driven adjustments: hostile encounters (with acclimation) and rate-limited
 * recovery rituals. Both funnel into {@link AdjustmentEngine#apply}.
 */
@Service
public class ActiveEffectsGateway {

    private static final Logger log = LoggerFactory.getLogger(ActiveEffectsGateway.class);

    private final LedgerStore store;
    private final AdjustmentEngine engine;
    private final EffectCatalog catalog;
    private final Clock clock;
    private final int acclimationThreshold;

    public ActiveEffectsGateway(LedgerStore store,
                                AdjustmentEngine engine,
                                EffectCatalog catalog,
                                Clock clock,
                                @Value("${lucidity.encounter.acclimation-threshold:6}") int acclimationThreshold) {
        this.store                = store;
        this.engine               = engine;
        this.catalog              = catalog;
        this.clock                = clock;
        this.acclimationThreshold = acclimationThreshold;
    }

    /**
     * Applies the loss for one encounter with {@code archetype}.
     * An unknown category fails before the exposure counter is touched. The exposure
     * increment commits with the score, so a failed encounter can be retried as-is.
     */
    public Mono<AdjustmentResult> applyEncounter(UUID actorId, String archetype, String category,
                                                 String locationId) {
        return Mono.fromCallable(() -> catalog.encounter(category))
            .flatMap(profile -> {
                String normalized = EffectCatalog.normalize(category);
                Mono<PlannedAdjustment> plan = Mono
                    .defer(() -> store.incrementExposure(actorId, archetype, clock.instant()))
                    .map(exposure -> {
                        int count = exposure.encounterCount();
                        int delta = profile.deltaFor(count, acclimationThreshold);
                        log.info("Encounter resolved. actorId={} archetype={} category={} count={} delta={}",
                                 actorId, archetype, normalized, count, delta);
                        return new PlannedAdjustment(delta, encounterMetadata(profile, archetype, normalized, count));
                    });
                return engine.apply(actorId, "encounter_" + normalized, locationId, plan, result -> Mono.empty());
            });
    }

    /**
     * Performs a recovery ritual. Fails with {@link OnCooldownException} while the
     * previous use is still cooling down; the score is not touched in that case.
     * The cooldown check and the new cooldown run under the actor lock and commit with
     * the score.
     */
    public Mono<AdjustmentResult> performRecovery(UUID actorId, String actionCode, String locationId) {
        return Mono.fromCallable(() -> catalog.recovery(actionCode))
            .flatMap(profile -> {
                String action = EffectCatalog.normalize(actionCode);
                Mono<PlannedAdjustment> plan = rejectIfCoolingDown(actorId, action)
                    .then(Mono.fromSupplier(() ->
                        new PlannedAdjustment(profile.delta(), Map.of("action_code", action))));
                return engine.apply(actorId, "recovery_" + action, locationId, plan,
                                    result -> startCooldown(actorId, action, profile));
            });
    }

    public Mono<CooldownStatus> getActionCooldown(UUID actorId, String actionCode) {
        return Mono.fromCallable(() -> {
                catalog.recovery(actionCode);
                return EffectCatalog.normalize(actionCode);
            })
            .flatMap(action -> store.getCooldown(actorId, action)
                .map(cooldown -> CooldownStatus.of(cooldown, clock.instant()))
                .defaultIfEmpty(CooldownStatus.available(action)));
    }

    // ── helpers ───────────────────────────────────────────────────────────────

    private Mono<Void> rejectIfCoolingDown(UUID actorId, String action) {
        return store.getCooldown(actorId, action)
            .flatMap(cooldown -> {
                Instant now = clock.instant();
                if (!cooldown.isActive(now)) {
                    return Mono.empty();
                }
                log.info("Recovery rejected, on cooldown. actorId={} action={} expiresAt={}",
                         actorId, action, cooldown.expiresAt());
                return Mono.error(new OnCooldownException(actorId, action, cooldown.expiresAt(),
                                                          cooldown.remaining(now)));
            })
            .then();
    }

    private Mono<Void> startCooldown(UUID actorId, String action, RecoveryProfile profile) {
        Instant expiresAt = clock.instant().plus(profile.cooldown());
        return store.setCooldown(actorId, action, expiresAt)
            .doOnNext(c -> log.info("Recovery cooldown started. actorId={} action={} expiresAt={}",
                                    actorId, action, c.expiresAt()))
            .then();
    }

    private Map<String, Object> encounterMetadata(EncounterProfile profile, String archetype,
                                                  String category, int count) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("archetype", archetype);
        metadata.put("encounter_category", category);
        metadata.put("encounter_count", count);
        metadata.put("acclimated", profile.isAcclimated(count, acclimationThreshold));
        return metadata;
    }
}
