package com.example.filament_ledger.repository;

import com.example.filament_ledger.model.MaterialColorEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface MaterialColorRepository extends JpaRepository<MaterialColorEntity, String> {
    List<MaterialColorEntity> findAllByOrderByMaterialAsc();
}
