package com.opsdata.reconciliation.exception;

public class ResourceNotFoundException extends ReconciliationException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
