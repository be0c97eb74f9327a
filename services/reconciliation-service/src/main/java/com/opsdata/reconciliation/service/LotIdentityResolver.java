package com.opsdata.reconciliation.service;

import com.opsdata.reconciliation.domain.LotEntity;
import com.opsdata.reconciliation.domain.LotKey;
import com.opsdata.reconciliation.exception.StorageException;
import com.opsdata.reconciliation.repository.LotRepository;
import java.time.Clock;
import java.util.Optional;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class LotIdentityResolver {

    private final LotRepository lotRepository;
    private final Clock clock;

    public LotIdentityResolver(LotRepository lotRepository, Clock clock) {
        this.lotRepository = lotRepository;
        this.clock = clock;
    }

    @Transactional
    public LotEntity resolve(LotKey key) {
        Optional<LotEntity> existing = lotRepository.findByLotCodeAndProductionDate(key.lotCode(), key.productionDate());
        if (existing.isPresent()) {
            return existing.get();
        }
        lotRepository.insertIfAbsent(key.lotCode(), key.productionDate(), clock.instant());
        return lotRepository.findByLotCodeAndProductionDate(key.lotCode(), key.productionDate())
            .orElseThrow(() -> new StorageException("Lot " + key + " is not visible after insert"));
    }
}
