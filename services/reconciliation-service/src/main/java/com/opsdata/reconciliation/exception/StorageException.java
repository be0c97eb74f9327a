package com.opsdata.reconciliation.exception;

public class StorageException extends ReconciliationException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
