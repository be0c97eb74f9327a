package com.opsdata.reconciliation.repository;

import com.opsdata.reconciliation.domain.ProductionRecordEntity;
import java.time.LocalDate;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ProductionRecordRepository extends JpaRepository<ProductionRecordEntity, Long> {

    List<ProductionRecordEntity> findByLotIdOrderBySourceUpdatedAtDescIdDesc(Long lotId);

    @Query("""
        select p from ProductionRecordEntity p join fetch p.lot l
        where l.productionDate between :fromDate and :toDate
        """)
    List<ProductionRecordEntity> findWithLotProducedBetween(
        @Param("fromDate") LocalDate fromDate,
        @Param("toDate") LocalDate toDate
    );
}
