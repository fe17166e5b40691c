package com.lucidityplatform.ledger.dto;

public record EncounterRequest(
    String archetype,
    String category,
    String locationId
) {}
