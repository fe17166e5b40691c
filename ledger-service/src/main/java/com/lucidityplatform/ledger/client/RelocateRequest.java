package com.lucidityplatform.ledger.client;

public record RelocateRequest(String targetRoomId, String reason) {}
