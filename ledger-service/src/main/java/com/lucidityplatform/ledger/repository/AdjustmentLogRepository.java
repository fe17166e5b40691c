package com.lucidityplatform.ledger.repository;

import com.lucidityplatform.ledger.model.AdjustmentLogEntity;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AdjustmentLogRepository extends ReactiveCrudRepository<AdjustmentLogEntity, Long> {
}
