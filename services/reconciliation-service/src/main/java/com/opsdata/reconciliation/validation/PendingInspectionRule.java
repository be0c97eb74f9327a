package com.opsdata.reconciliation.validation;

import com.opsdata.reconciliation.domain.FlagType;
import com.opsdata.reconciliation.repository.IntegrityFlagRepository;
import com.opsdata.reconciliation.repository.LotRepository;
import java.time.Clock;
import java.util.List;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

@Component
@Order(1)
public class PendingInspectionRule extends LotFlaggingRule {

    private final LotRepository lotRepository;

    public PendingInspectionRule(
        IntegrityFlagRepository flagRepository,
        TransactionTemplate unitTransactionTemplate,
        Clock clock,
        LotRepository lotRepository
    ) {
        super(flagRepository, unitTransactionTemplate, clock);
        this.lotRepository = lotRepository;
    }

    @Override
    public String name() {
        return "PendingInspections";
    }

    @Override
    FlagType flagType() {
        return FlagType.PENDING_INSPECTION;
    }

    @Override
    List<FlagCandidate> findViolations() {
        return lotRepository.findLotsMissingQuality().stream()
            .map(lot -> new FlagCandidate(lot.getId(), lot.getLotCode(),
                "Lot " + lot.getLotCode() + " produced on " + lot.getProductionDate() + " is pending quality inspection"))
            .toList();
    }

    @Override
    int markLot(Long lotId) {
        return lotRepository.updatePendingInspection(lotId, true);
    }
}
