package com.opsdata.reconciliation.exception;

public class IntegrityConstraintException extends ReconciliationException {

    public IntegrityConstraintException(String message) {
        super(message);
    }

    public IntegrityConstraintException(String message, Throwable cause) {
        super(message, cause);
    }
}
