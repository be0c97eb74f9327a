package com.opsdata.reconciliation.repository;

import com.opsdata.reconciliation.domain.RunFailureEntity;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface RunFailureRepository extends JpaRepository<RunFailureEntity, UUID> {

    List<RunFailureEntity> findTop20ByRunIdOrderByCreatedAtDesc(UUID runId);
}
