package com.opsdata.reconciliation.repository;

import com.opsdata.reconciliation.domain.FlagType;
import com.opsdata.reconciliation.domain.IntegrityFlagEntity;
import java.time.Instant;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface IntegrityFlagRepository extends JpaRepository<IntegrityFlagEntity, Long> {

    @Modifying
    @Query(nativeQuery = true, value = """
        insert into data_integrity_flags (lot_id, flag_type, severity, description,
                                          is_resolved, open_key, detected_at)
        values (:lotId, :flagType, :severity, :description, false, :openKey, :detectedAt)
        on conflict do nothing
        """)
    int insertIfNoOpenFlag(
        @Param("lotId") Long lotId,
        @Param("flagType") String flagType,
        @Param("severity") String severity,
        @Param("description") String description,
        @Param("openKey") String openKey,
        @Param("detectedAt") Instant detectedAt
    );

    @Query("select f from IntegrityFlagEntity f join fetch f.lot where f.resolved = false")
    List<IntegrityFlagEntity> findUnresolved();

    List<IntegrityFlagEntity> findByLotIdAndResolvedFalseOrderByDetectedAtDesc(Long lotId);

    long countByLotIdAndFlagTypeAndResolvedFalse(Long lotId, FlagType flagType);
}
