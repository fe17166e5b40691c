package com.lucidityplatform.ledger.dto;

import java.util.Map;

public record AdjustRequest(
    int delta,
    String reasonCode,
    Map<String, Object> metadata,
    String locationId
) {}
