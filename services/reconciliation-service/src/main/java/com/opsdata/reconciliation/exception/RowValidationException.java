package com.opsdata.reconciliation.exception;

public class RowValidationException extends ReconciliationException {

    public RowValidationException(String message) {
        super(message);
    }
}
