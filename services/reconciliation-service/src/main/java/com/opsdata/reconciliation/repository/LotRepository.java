package com.opsdata.reconciliation.repository;

import com.opsdata.reconciliation.domain.LotEntity;
import com.opsdata.reconciliation.domain.ShippingRecordEntity;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface LotRepository extends JpaRepository<LotEntity, Long> {

    Optional<LotEntity> findByLotCodeAndProductionDate(String lotCode, LocalDate productionDate);

    List<LotEntity> findByLotCodeIgnoreCaseOrderByProductionDateDesc(String lotCode);

    @Modifying
    @Query(nativeQuery = true, value = """
        insert into lots (lot_code, production_date, is_pending_inspection,
                          has_data_integrity_issue, has_date_conflict, created_at)
        values (:lotCode, :productionDate, true, false, false, :createdAt)
        on conflict do nothing
        """)
    int insertIfAbsent(
        @Param("lotCode") String lotCode,
        @Param("productionDate") LocalDate productionDate,
        @Param("createdAt") Instant createdAt
    );

    @Modifying(flushAutomatically = true)
    @Query("""
        update LotEntity l set l.pendingInspection = :value
        where l.id = :lotId and l.pendingInspection <> :value
        """)
    int updatePendingInspection(@Param("lotId") Long lotId, @Param("value") boolean value);

    @Modifying(flushAutomatically = true)
    @Query("""
        update LotEntity l set l.integrityIssue = :value
        where l.id = :lotId and l.integrityIssue <> :value
        """)
    int updateIntegrityIssue(@Param("lotId") Long lotId, @Param("value") boolean value);

    @Modifying(flushAutomatically = true)
    @Query("""
        update LotEntity l set l.dateConflict = :value
        where l.id = :lotId and l.dateConflict <> :value
        """)
    int updateDateConflict(@Param("lotId") Long lotId, @Param("value") boolean value);

    @Query("""
        select l from LotEntity l
        where not exists (select q.id from QualityInspectionRecordEntity q where q.lot = l)
        order by l.id
        """)
    List<LotEntity> findLotsMissingQuality();

    @Query("""
        select s from ShippingRecordEntity s join fetch s.lot l
        where not exists (select q.id from QualityInspectionRecordEntity q where q.lot = l)
        order by l.id
        """)
    List<ShippingRecordEntity> findOrphanedShipments();

    @Query("""
        select s from ShippingRecordEntity s join fetch s.lot l
        where s.shipDate < l.productionDate
        order by l.id
        """)
    List<ShippingRecordEntity> findDateConflicts();

    @Query("""
        select l from LotEntity l
        where (:fromDate is null or l.productionDate >= :fromDate)
          and (:toDate is null or l.productionDate <= :toDate)
          and (:line is null or exists (
                select p.id from ProductionRecordEntity p
                where p.lot = l and upper(p.productionLineId) = upper(:line)))
        order by l.productionDate desc, l.id desc
        """)
    List<LotEntity> search(
        @Param("fromDate") LocalDate fromDate,
        @Param("toDate") LocalDate toDate,
        @Param("line") String line,
        Pageable pageable
    );
}
