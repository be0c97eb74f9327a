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
@Order(3)
public class DateConflictRule extends LotFlaggingRule {

    private final LotRepository lotRepository;

    public DateConflictRule(
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
        return "DateConflicts";
    }

    @Override
    FlagType flagType() {
        return FlagType.DATE_CONFLICT;
    }

    @Override
    List<FlagCandidate> findViolations() {
        return lotRepository.findDateConflicts().stream()
            .map(shipment -> new FlagCandidate(shipment.getLot().getId(), shipment.getLot().getLotCode(),
                "Lot " + shipment.getLot().getLotCode() + ": Ship date (" + shipment.getShipDate()
                    + ") is before production date (" + shipment.getLot().getProductionDate() + ")"))
            .toList();
    }

    @Override
    int markLot(Long lotId) {
        return lotRepository.updateDateConflict(lotId, true);
    }
}
