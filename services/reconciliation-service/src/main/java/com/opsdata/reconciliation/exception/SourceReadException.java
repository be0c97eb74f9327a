package com.opsdata.reconciliation.exception;

public class SourceReadException extends ReconciliationException {

    public SourceReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
