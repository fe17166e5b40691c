package com.lucidityplatform.common.exception;

public class UnknownActionCodeException extends LucidityException {
    private final String actionCode;

    public UnknownActionCodeException(String actionCode) {
        super("UNKNOWN_ACTION_CODE", "Unknown recovery action: " + actionCode);
        this.actionCode = actionCode;
    }

    public String getActionCode() {
        return actionCode;
    }
}
