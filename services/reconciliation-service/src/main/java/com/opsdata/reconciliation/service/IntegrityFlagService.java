package com.opsdata.reconciliation.service;

import com.opsdata.reconciliation.domain.FlagSeverity;
import com.opsdata.reconciliation.domain.FlagSummaryRow;
import com.opsdata.reconciliation.domain.FlagType;
import com.opsdata.reconciliation.domain.FlagView;
import com.opsdata.reconciliation.domain.IntegrityFlagEntity;
import com.opsdata.reconciliation.exception.ResourceNotFoundException;
import com.opsdata.reconciliation.repository.IntegrityFlagRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class IntegrityFlagService {

    private static final Logger LOGGER = LoggerFactory.getLogger(IntegrityFlagService.class);

    private static final Comparator<IntegrityFlagEntity> MOST_SEVERE_FIRST = Comparator
        .comparing(IntegrityFlagEntity::getSeverity, Comparator.reverseOrder())
        .thenComparing(IntegrityFlagEntity::getDetectedAt, Comparator.reverseOrder())
        .thenComparing(IntegrityFlagEntity::getId);

    private final IntegrityFlagRepository flagRepository;
    private final Clock clock;

    public IntegrityFlagService(IntegrityFlagRepository flagRepository, Clock clock) {
        this.flagRepository = flagRepository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<FlagView> listUnresolved() {
        return flagRepository.findUnresolved().stream()
            .sorted(MOST_SEVERE_FIRST)
            .map(flag -> FlagView.of(flag, flag.getLot()))
            .toList();
    }

    @Transactional(readOnly = true)
    public List<FlagSummaryRow> summary() {
        Map<TypeAndSeverity, List<IntegrityFlagEntity>> groups = flagRepository.findUnresolved().stream()
            .collect(Collectors.groupingBy(
                flag -> new TypeAndSeverity(flag.getFlagType(), flag.getSeverity()),
                LinkedHashMap::new,
                Collectors.toList()));

        return groups.entrySet().stream()
            .sorted(Comparator.comparing((Map.Entry<TypeAndSeverity, List<IntegrityFlagEntity>> entry) -> entry.getKey().severity())
                .reversed()
                .thenComparing(entry -> entry.getValue().size(), Comparator.reverseOrder()))
            .map(entry -> new FlagSummaryRow(
                entry.getKey().type().label(),
                entry.getKey().severity().label(),
                entry.getValue().size(),
                entry.getValue().stream().map(IntegrityFlagEntity::getDetectedAt).max(Comparator.naturalOrder()).orElse(null)
            ))
            .toList();
    }

    @Transactional
    public FlagView resolve(Long flagId) {
        IntegrityFlagEntity flag = flagRepository.findById(flagId)
            .orElseThrow(() -> new ResourceNotFoundException("Integrity flag not found: " + flagId));
        if (!flag.isResolved()) {
            Instant now = clock.instant();
            flag.resolve(now);
            flagRepository.save(flag);
            LOGGER.info("Integrity flag {} ({}) resolved for lot {}", flagId, flag.getFlagType(), flag.getLot().getLotCode());
        }
        return FlagView.of(flag, flag.getLot());
    }

    private record TypeAndSeverity(FlagType type, FlagSeverity severity) {
    }
}
