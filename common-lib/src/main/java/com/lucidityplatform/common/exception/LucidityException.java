package com.lucidityplatform.common.exception;

/**
 * Root of the lucidity error taxonomy. {@code code} is the stable machine-readable
 * name surfaced to callers.
 */
public class LucidityException extends RuntimeException {
    private final String code;

    public LucidityException(String code, String message) {
        super(message);
        this.code = code;
    }

    public LucidityException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
