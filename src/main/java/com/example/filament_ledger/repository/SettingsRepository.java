package com.example.filament_ledger.repository;

import com.example.filament_ledger.model.SettingsEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface SettingsRepository extends JpaRepository<SettingsEntity, UUID> {
    Optional<SettingsEntity> findFirstByOrderByIdAsc();
}
