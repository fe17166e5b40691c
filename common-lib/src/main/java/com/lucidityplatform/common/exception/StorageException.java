package com.lucidityplatform.common.exception;

/**
 * Transient ledger failure (driver error or timeout). The operation that raised it
 * wrote nothing and may be retried.
 */
public class StorageException extends LucidityException {
    private final String operation;

    public StorageException(String operation, Throwable cause) {
        super("STORAGE_ERROR", "Ledger storage failed during " + operation, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
