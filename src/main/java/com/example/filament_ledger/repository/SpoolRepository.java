package com.example.filament_ledger.repository;

import com.example.filament_ledger.model.SpoolEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface SpoolRepository extends JpaRepository<SpoolEntity, UUID> {
    List<SpoolEntity> findByArchivedFalseOrderByAcquiredAtDesc();

    List<SpoolEntity> findByArchivedTrueOrderByAcquiredAtDesc();
}
