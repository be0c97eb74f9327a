package com.opsdata.reconciliation.validation;

import com.opsdata.reconciliation.domain.ValidationResult;

public interface ValidationRule {

    String name();

    ValidationResult run();
}
