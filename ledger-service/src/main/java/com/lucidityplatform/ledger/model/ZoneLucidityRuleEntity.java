package com.lucidityplatform.ledger.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * World-builder drain rate for a plane, zone or sub-zone. Null {@code zone} or
 * {@code subZone} means "any".
 */
@Data
@NoArgsConstructor
@Table("zone_lucidity_rules")
public class ZoneLucidityRuleEntity {

    @Id
    private Long id;

    private String plane;
    private String zone;
    private String subZone;
    private Double drainRate;
}
