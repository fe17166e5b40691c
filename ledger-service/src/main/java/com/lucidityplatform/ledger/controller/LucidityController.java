package com.lucidityplatform.ledger.controller;

import com.lucidityplatform.common.model.AdjustmentResult;
import com.lucidityplatform.common.model.CooldownStatus;
import com.lucidityplatform.common.model.LucidityRecord;
import com.lucidityplatform.ledger.dto.AdjustRequest;
import com.lucidityplatform.ledger.dto.EncounterRequest;
import com.lucidityplatform.ledger.dto.RecoveryRequest;
import com.lucidityplatform.ledger.service.ActiveEffectsGateway;
import com.lucidityplatform.ledger.service.AdjustmentEngine;
import com.lucidityplatform.ledger.service.CatatoniaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Operator and game-server API for lucidity state. Errors are mapped by
 * {@link GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/v1/lucidity")
public class LucidityController {

    private static final Logger log = LoggerFactory.getLogger(LucidityController.class);

    private final AdjustmentEngine engine;
    private final ActiveEffectsGateway gateway;
    private final CatatoniaRegistry catatoniaRegistry;

    public LucidityController(AdjustmentEngine engine,
                              ActiveEffectsGateway gateway,
                              CatatoniaRegistry catatoniaRegistry) {
        this.engine            = engine;
        this.gateway           = gateway;
        this.catatoniaRegistry = catatoniaRegistry;
    }

    @GetMapping("/{actorId}")
    public Mono<ResponseEntity<LucidityRecord>> getRecord(@PathVariable UUID actorId) {
        return engine.getRecord(actorId).map(ResponseEntity::ok);
    }

    @PostMapping("/{actorId}/adjust")
    public Mono<ResponseEntity<AdjustmentResult>> adjust(@PathVariable UUID actorId,
                                                         @RequestBody AdjustRequest request) {
        if (request.reasonCode() == null || request.reasonCode().isBlank()) {
            return Mono.error(new IllegalArgumentException("reasonCode is required"));
        }
        log.info("Adjustment requested. actorId={} delta={} reason={}",
                 actorId, request.delta(), request.reasonCode());
        return engine.apply(actorId, request.delta(), request.reasonCode(),
                            request.metadata(), request.locationId())
            .map(ResponseEntity::ok);
    }

    @PostMapping("/{actorId}/encounter")
    public Mono<ResponseEntity<AdjustmentResult>> encounter(@PathVariable UUID actorId,
                                                            @RequestBody EncounterRequest request) {
        if (request.archetype() == null || request.archetype().isBlank()) {
            return Mono.error(new IllegalArgumentException("archetype is required"));
        }
        log.info("Encounter requested. actorId={} archetype={} category={}",
                 actorId, request.archetype(), request.category());
        return gateway.applyEncounter(actorId, request.archetype(), request.category(), request.locationId())
            .map(ResponseEntity::ok);
    }

    @PostMapping("/{actorId}/recovery")
    public Mono<ResponseEntity<AdjustmentResult>> recovery(@PathVariable UUID actorId,
                                                           @RequestBody RecoveryRequest request) {
        log.info("Recovery requested. actorId={} action={}", actorId, request.actionCode());
        return gateway.performRecovery(actorId, request.actionCode(), request.locationId())
            .map(ResponseEntity::ok);
    }

    @GetMapping("/{actorId}/cooldowns/{actionCode}")
    public Mono<ResponseEntity<CooldownStatus>> cooldown(@PathVariable UUID actorId,
                                                         @PathVariable String actionCode) {
        return gateway.getActionCooldown(actorId, actionCode).map(ResponseEntity::ok);
    }

    @DeleteMapping("/{actorId}/liabilities/{code}")
    public Mono<ResponseEntity<Map<String, Object>>> clearLiability(
            @PathVariable UUID actorId,
            @PathVariable String code,
            @RequestParam(defaultValue = "false") boolean removeAll) {
        return engine.clearLiability(actorId, code, removeAll)
            .map(changed -> ResponseEntity.ok(Map.<String, Object>of(
                "actorId", actorId, "code", code, "changed", changed)));
    }

    @GetMapping("/catatonia")
    public Mono<ResponseEntity<Map<UUID, Instant>>> catatonia() {
        return Mono.just(ResponseEntity.ok(catatoniaRegistry.snapshot()));
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<String>> health() {
        return Mono.just(ResponseEntity.ok("OK"));
    }
}
