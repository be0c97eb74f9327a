package com.opsdata.reconciliation.repository;

import com.opsdata.reconciliation.domain.ReconciliationRunEntity;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ReconciliationRunRepository extends JpaRepository<ReconciliationRunEntity, UUID> {
}
