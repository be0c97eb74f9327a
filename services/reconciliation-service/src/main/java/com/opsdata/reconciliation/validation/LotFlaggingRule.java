package com.opsdata.reconciliation.validation;

import com.opsdata.reconciliation.domain.FlagType;
import com.opsdata.reconciliation.domain.IntegrityFlagEntity;
import com.opsdata.reconciliation.domain.ValidationResult;
import com.opsdata.reconciliation.exception.FailureClassifier;
import com.opsdata.reconciliation.repository.IntegrityFlagRepository;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionTemplate;

abstract class LotFlaggingRule implements ValidationRule {

    private static final Logger LOGGER = LoggerFactory.getLogger(LotFlaggingRule.class);

    private final IntegrityFlagRepository flagRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    LotFlaggingRule(IntegrityFlagRepository flagRepository, TransactionTemplate transactionTemplate, Clock clock) {
        this.flagRepository = flagRepository;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    abstract FlagType flagType();

    abstract List<FlagCandidate> findViolations();

    abstract int markLot(Long lotId);

    @Override
    public ValidationResult run() {
        List<FlagCandidate> candidates;
        try {
            candidates = transactionTemplate.execute(status -> findViolations());
        } catch (RuntimeException ex) {
            LOGGER.warn("{} scan failed: {}", name(), ex.getMessage());
            return new ValidationResult(name(), 0, 0, 0,
                List.of(name() + " validation failed: " + FailureClassifier.describe(ex)));
        }

        int created = 0;
        int skipped = 0;
        int lotsUpdated = 0;
        List<String> errors = new ArrayList<>();
        for (FlagCandidate candidate : candidates) {
            try {
                int[] writes = transactionTemplate.execute(status -> new int[] {flagLot(candidate), markLot(candidate.lotId())});
                if (writes[0] > 0) {
                    created++;
                } else {
                    skipped++;
                }
                lotsUpdated += writes[1] > 0 ? 1 : 0;
            } catch (RuntimeException ex) {
                LOGGER.warn("{} failed for lot {}: {}", name(), candidate.lotCode(), ex.getMessage());
                errors.add("Error validating lot " + candidate.lotCode() + ": " + FailureClassifier.describe(ex));
            }
        }

        LOGGER.info("{} completed: candidates={} created={} skipped={} lotsUpdated={} errors={}",
            name(), candidates.size(), created, skipped, lotsUpdated, errors.size());
        return new ValidationResult(name(), created, skipped, lotsUpdated, errors);
    }

    private int flagLot(FlagCandidate candidate) {
        FlagType type = flagType();
        return flagRepository.insertIfNoOpenFlag(
            candidate.lotId(),
            type.name(),
            type.severity().name(),
            FailureClassifier.truncate(candidate.description()),
            IntegrityFlagEntity.openKey(candidate.lotId(), type),
            clock.instant()
        );
    }
}
