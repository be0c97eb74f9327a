package com.opsdata.reconciliation.repository;

import com.opsdata.reconciliation.domain.QualityInspectionRecordEntity;
import java.time.LocalDate;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface QualityInspectionRecordRepository extends JpaRepository<QualityInspectionRecordEntity, Long> {

    List<QualityInspectionRecordEntity> findByLotIdOrderByInspectionDateDescIdDesc(Long lotId);

    List<QualityInspectionRecordEntity> findByInspectionDateBetween(LocalDate fromDate, LocalDate toDate);

    long countByLotId(Long lotId);
}
