package com.lucidityplatform.ledger.dto;

public record RecoveryRequest(
    String actionCode,
    String locationId
) {}
