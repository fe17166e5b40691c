package com.lucidityplatform.ledger.repository;

import com.lucidityplatform.ledger.model.ZoneLucidityRuleEntity;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ZoneLucidityRuleRepository extends ReactiveCrudRepository<ZoneLucidityRuleEntity, Long> {
}
