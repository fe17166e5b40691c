package com.lucidityplatform.ledger.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lucidityplatform.common.exception.ActorNotFoundException;
import com.lucidityplatform.common.exception.LucidityException;
import com.lucidityplatform.common.exception.StorageException;
import com.lucidityplatform.common.model.ActorPresence;
import com.lucidityplatform.common.model.AdjustmentLogEntry;
import com.lucidityplatform.common.model.CooldownRecord;
import com.lucidityplatform.common.model.ExposureState;
import com.lucidityplatform.common.model.Liability;
import com.lucidityplatform.common.model.LucidityRecord;
import com.lucidityplatform.common.model.LucidityTier;
import com.lucidityplatform.ledger.model.ActorPresenceEntity;
import com.lucidityplatform.ledger.model.AdjustmentLogEntity;
import com.lucidityplatform.ledger.model.CooldownEntity;
import com.lucidityplatform.ledger.model.ExposureStateEntity;
import com.lucidityplatform.ledger.model.LucidityRecordEntity;
import com.lucidityplatform.ledger.repository.ActorPresenceRepository;
import com.lucidityplatform.ledger.repository.AdjustmentLogRepository;
import com.lucidityplatform.ledger.repository.CooldownRepository;
import com.lucidityplatform.ledger.repository.ExposureStateRepository;
import com.lucidityplatform.ledger.repository.LucidityRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.ReactiveTransactionManager;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * PostgreSQL-backed {@link LedgerStore} on Spring Data R2DBC.
 *
 * <p>Per-actor exclusion is a {@code SELECT … FOR UPDATE} row lock taken inside the
 * transaction opened by {@link #inActorTransaction}. Every call is bounded by
 * {@code lucidity.storage.timeout}; driver errors and timeouts surface as
 * {@link StorageException}. Consecutive failures escalate the log level from WARN to
 * ERROR so that a dead database is visible without flooding on a single blip.
 */
@Component
public class R2dbcLedgerStore implements LedgerStore {

    private static final Logger log = LoggerFactory.getLogger(R2dbcLedgerStore.class);

    private static final int ERROR_AFTER_CONSECUTIVE_FAILURES = 3;

    private static final TypeReference<List<Liability>> LIABILITY_LIST = new TypeReference<>() {};

    private final LucidityRecordRepository recordRepository;
    private final AdjustmentLogRepository  logRepository;
    private final ExposureStateRepository  exposureRepository;
    private final CooldownRepository       cooldownRepository;
    private final ActorPresenceRepository  actorRepository;
    private final TransactionalOperator    transactionalOperator;
    private final ObjectMapper             objectMapper;
    private final Duration                 timeout;

    private final AtomicInteger consecutiveFailures = new AtomicInteger();

    public R2dbcLedgerStore(LucidityRecordRepository recordRepository,
                            AdjustmentLogRepository logRepository,
                            ExposureStateRepository exposureRepository,
                            CooldownRepository cooldownRepository,
                            ActorPresenceRepository actorRepository,
                            ReactiveTransactionManager transactionManager,
                            ObjectMapper objectMapper,
                            @Value("${lucidity.storage.timeout:5s}") Duration timeout) {
        this.recordRepository      = recordRepository;
        this.logRepository         = logRepository;
        this.exposureRepository    = exposureRepository;
        this.cooldownRepository    = cooldownRepository;
        this.actorRepository       = actorRepository;
        this.transactionalOperator = TransactionalOperator.create(transactionManager);
        this.objectMapper          = objectMapper;
        this.timeout               = timeout;
    }

    // ── records ───────────────────────────────────────────────────────────────

    @Override
    public Mono<LucidityRecord> getOrCreate(UUID actorId) {
        Mono<LucidityRecord> load = recordRepository.ensureRecord(actorId)
            .then(recordRepository.findById(actorId))
            .switchIfEmpty(Mono.error(() -> new ActorNotFoundException(actorId)))
            .map(this::toRecord);
        return guard("getOrCreate", load);
    }

    @Override
    public <T> Mono<T> inActorTransaction(UUID actorId, Function<LucidityRecord, Mono<T>> work) {
        Mono<T> unit = recordRepository.ensureRecord(actorId)
            .then(recordRepository.lockByActorId(actorId))
            .switchIfEmpty(Mono.error(() -> new ActorNotFoundException(actorId)))
            .map(this::toRecord)
            .flatMap(work);
        return guard("inActorTransaction", transactionalOperator.transactional(unit));
    }

    @Override
    public Mono<Void> saveAdjustment(LucidityRecord record, AdjustmentLogEntry entry) {
        Mono<Integer> update = Mono.fromCallable(() -> writeJson(record.liabilities()))
            .flatMap(liabilities -> recordRepository.updateRecord(
                record.actorId(), record.score(), record.tier().label(), liabilities,
                record.catatoniaEnteredAt(), record.lastUpdatedAt()));
        Mono<AdjustmentLogEntity> append = Mono.fromCallable(() -> toLogEntity(entry))
            .flatMap(logRepository::save);
        return update
            .flatMap(rows -> rows == 0
                ? Mono.<AdjustmentLogEntity>error(new ActorNotFoundException(record.actorId()))
                : append)
            .then();
    }

    @Override
    public Flux<LucidityRecord> findRecords(Collection<UUID> actorIds) {
        if (actorIds.isEmpty()) {
            return Flux.empty();
        }
        return guardMany("findRecords", recordRepository.findByActorIdIn(actorIds).map(this::toRecord));
    }

    // ── exposure ──────────────────────────────────────────────────────────────

    @Override
    public Mono<ExposureState> getExposure(UUID actorId, String archetype) {
        return guard("getExposure",
            exposureRepository.findByActorIdAndArchetype(actorId, archetype).map(this::toExposure));
    }

    @Override
    public Mono<ExposureState> incrementExposure(UUID actorId, String archetype, Instant encounteredAt) {
        return guard("incrementExposure",
            exposureRepository.incrementExposure(actorId, archetype, encounteredAt).map(this::toExposure));
    }

    // ── cooldowns ─────────────────────────────────────────────────────────────

    @Override
    public Mono<CooldownRecord> getCooldown(UUID actorId, String actionCode) {
        return guard("getCooldown",
            cooldownRepository.findByActorIdAndActionCode(actorId, actionCode).map(this::toCooldown));
    }

    @Override
    public Mono<CooldownRecord> setCooldown(UUID actorId, String actionCode, Instant expiresAt) {
        return guard("setCooldown",
            cooldownRepository.upsertCooldown(actorId, actionCode, expiresAt).map(this::toCooldown));
    }

    @Override
    public Mono<Integer> deleteCooldowns(UUID actorId, String prefix) {
        String pattern = escapeLike(prefix) + "%";
        return guard("deleteCooldowns", cooldownRepository.deleteByActionCodeLike(actorId, pattern));
    }

    // ── character registry ────────────────────────────────────────────────────

    @Override
    public Flux<ActorPresence> listActiveActors(Instant activeSince, Instant createdSince) {
        return guardMany("listActiveActors",
            actorRepository.findEligible(activeSince, createdSince).map(this::toPresence));
    }

    @Override
    public Mono<Integer> findMaxScore(UUID actorId) {
        Mono<Integer> lookup = actorRepository.findById(actorId)
            .switchIfEmpty(Mono.error(() -> new ActorNotFoundException(actorId)))
            .map(actor -> actor.getMaxLucidity() == null
                ? ActorPresence.DEFAULT_MAX_SCORE
                : actor.getMaxLucidity());
        return guard("findMaxScore", lookup);
    }

    // ── error handling ────────────────────────────────────────────────────────

    private <T> Mono<T> guard(String operation, Mono<T> call) {
        return call.timeout(timeout)
            .doOnSuccess(v -> consecutiveFailures.set(0))
            .onErrorMap(e -> !(e instanceof LucidityException), e -> storageFailure(operation, e));
    }

    private <T> Flux<T> guardMany(String operation, Flux<T> call) {
        return call.timeout(timeout)
            .doOnComplete(() -> consecutiveFailures.set(0))
            .onErrorMap(e -> !(e instanceof LucidityException), e -> storageFailure(operation, e));
    }

    private StorageException storageFailure(String operation, Throwable cause) {
        int failures = consecutiveFailures.incrementAndGet();
        if (failures >= ERROR_AFTER_CONSECUTIVE_FAILURES) {
            log.error("Ledger storage failure. operation={} consecutiveFailures={}", operation, failures, cause);
        } else {
            log.warn("Ledger storage failure. operation={} consecutiveFailures={} cause={}",
                     operation, failures, cause.toString());
        }
        return new StorageException(operation, cause);
    }

    // ── mapping ───────────────────────────────────────────────────────────────

    private LucidityRecord toRecord(LucidityRecordEntity entity) {
        return new LucidityRecord(
            entity.getActorId(),
            entity.getScore(),
            LucidityTier.fromLabel(entity.getTier()),
            readLiabilities(entity.getLiabilities()),
            entity.getCatatoniaEnteredAt(),
            entity.getLastUpdatedAt()
        );
    }

    private AdjustmentLogEntity toLogEntity(AdjustmentLogEntry entry) {
        AdjustmentLogEntity entity = new AdjustmentLogEntity();
        entity.setActorId(entry.actorId());
        entity.setDelta(entry.delta());
        entity.setReasonCode(entry.reasonCode());
        entity.setMetadata(writeJson(entry.metadata()));
        entity.setLocationId(entry.locationId());
        entity.setCreatedAt(entry.createdAt());
        return entity;
    }

    private ExposureState toExposure(ExposureStateEntity entity) {
        return new ExposureState(entity.getActorId(), entity.getArchetype(),
                                 entity.getEncounterCount(), entity.getLastEncounterAt());
    }

    private CooldownRecord toCooldown(CooldownEntity entity) {
        return new CooldownRecord(entity.getActorId(), entity.getActionCode(), entity.getCooldownExpiresAt());
    }

    private ActorPresence toPresence(ActorPresenceEntity entity) {
        int maxScore = entity.getMaxLucidity() == null
            ? ActorPresence.DEFAULT_MAX_SCORE
            : entity.getMaxLucidity();
        return new ActorPresence(entity.getActorId(), entity.getCurrentRoomId(),
                                 entity.getLastActiveAt(), entity.getCreatedAt(), maxScore);
    }

    private List<Liability> readLiabilities(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, LIABILITY_LIST);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Corrupt liabilities column", e);
        }
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value == null ? Map.of() : value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to encode ledger column", e);
        }
    }

    private static String escapeLike(String prefix) {
        return prefix.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
