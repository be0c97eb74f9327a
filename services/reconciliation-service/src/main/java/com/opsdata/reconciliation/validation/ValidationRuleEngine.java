package com.opsdata.reconciliation.validation;

import com.opsdata.reconciliation.domain.ValidationResult;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ValidationRuleEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(ValidationRuleEngine.class);

    private final List<ValidationRule> rules;

    public ValidationRuleEngine(List<ValidationRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public List<ValidationResult> runAll() {
        List<ValidationResult> results = new ArrayList<>(rules.size());
        for (ValidationRule rule : rules) {
            results.add(rule.run());
        }
        int created = results.stream().mapToInt(ValidationResult::flagsCreated).sum();
        LOGGER.info("Validation completed: {} rules, {} flags created", results.size(), created);
        return results;
    }
}
