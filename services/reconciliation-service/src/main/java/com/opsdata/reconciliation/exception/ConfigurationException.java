package com.opsdata.reconciliation.exception;

public class ConfigurationException extends ReconciliationException {

    public ConfigurationException(String message) {
        super(message);
    }
}
