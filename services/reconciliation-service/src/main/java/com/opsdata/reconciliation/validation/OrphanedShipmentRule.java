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
@Order(2)
public class OrphanedShipmentRule extends LotFlaggingRule {

    private final LotRepository lotRepository;

    public OrphanedShipmentRule(
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
        return "OrphanedShipments";
    }

    @Override
    FlagType flagType() {
        return FlagType.ORPHANED_SHIPMENT;
    }

    @Override
    List<FlagCandidate> findViolations() {
        return lotRepository.findOrphanedShipments().stream()
            .map(shipment -> new FlagCandidate(shipment.getLot().getId(), shipment.getLot().getLotCode(),
                "Lot " + shipment.getLot().getLotCode() + " shipped to " + shipment.getDestination()
                    + " without quality inspection"))
            .toList();
    }

    @Override
    int markLot(Long lotId) {
        return lotRepository.updateIntegrityIssue(lotId, true);
    }
}
