package com.lucidityplatform.common.event;

import com.fasterxml.jackson.annotation.JsonValue;

/** Distinguishing status code carried by {@link LucidityStatusEvent}. */
public enum LucidityStatus {
    CATATONIC("catatonic"),
    SUCCESS("success"),
    DELIRIUM("delirium"),
    SANITARIUM("sanitarium"),
    HALLUCINATION("hallucination");

    private final String code;

    LucidityStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
