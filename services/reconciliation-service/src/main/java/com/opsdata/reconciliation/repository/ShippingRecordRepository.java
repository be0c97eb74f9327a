package com.opsdata.reconciliation.repository;

import com.opsdata.reconciliation.domain.ShippingRecordEntity;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ShippingRecordRepository extends JpaRepository<ShippingRecordEntity, Long> {

    Optional<ShippingRecordEntity> findByLotId(Long lotId);
}
