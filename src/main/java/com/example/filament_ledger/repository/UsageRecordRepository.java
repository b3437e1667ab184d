package com.example.filament_ledger.repository;

import com.example.filament_ledger.model.UsageRecordEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Usage rows plus the spool→usage ownership index queries.
 */
public interface UsageRecordRepository extends JpaRepository<UsageRecordEntity, UUID> {
    List<UsageRecordEntity> findBySpoolIdOrderByRecordedAtDesc(UUID spoolId);

    @Query("select u.id from UsageRecordEntity u where u.spoolId = :spoolId")
    List<UUID> findIdsBySpoolId(@Param("spoolId") UUID spoolId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from UsageRecordEntity u where u.id in :ids")
    int deleteByIdIn(@Param("ids") Collection<UUID> ids);
}
