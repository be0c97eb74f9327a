package com.opsdata.reconciliation.repository;

import com.opsdata.reconciliation.domain.SourceHealthStatus;
import com.opsdata.reconciliation.domain.SourceMetadataEntity;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface SourceMetadataRepository extends JpaRepository<SourceMetadataEntity, Long> {

    Optional<SourceMetadataEntity> findBySourceName(String sourceName);

    List<SourceMetadataEntity> findAllByOrderBySourceNameAsc();

    @Modifying
    @Query(nativeQuery = true, value = """
        insert into data_source_metadatas (source_name, source_location, file_format, last_updated, refresh_status)
        values (:sourceName, :location, :format, :lastUpdated, :status)
        on conflict do nothing
        """)
    int insertIfAbsent(
        @Param("sourceName") String sourceName,
        @Param("location") String location,
        @Param("format") String format,
        @Param("lastUpdated") Instant lastUpdated,
        @Param("status") String status
    );

    @Modifying
    @Query("""
        update SourceMetadataEntity m
        set m.sourceLocation = :location, m.fileFormat = :format,
            m.lastUpdated = :lastUpdated, m.refreshStatus = :status
        where m.sourceName = :sourceName
        """)
    int updateBySourceName(
        @Param("sourceName") String sourceName,
        @Param("location") String location,
        @Param("format") String format,
        @Param("lastUpdated") Instant lastUpdated,
        @Param("status") SourceHealthStatus status
    );
}
