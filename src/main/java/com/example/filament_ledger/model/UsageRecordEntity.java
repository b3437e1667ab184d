package com.example.filament_ledger.model;

import com.example.filament_ledger.ledger.UsageCategory;
import com.example.filament_ledger.ledger.UsageRecord;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.UUID;

/**
 * Usage event row. {@code spool_id} is a plain indexed column, not a mapped relation: the store keeps
 * the spool→usage ownership index and issues the cascade delete itself.
 */
@Entity
@Table(name = "usage_record", indexes = @Index(name = "ix_usage_record_spool", columnList = "spool_id"))
public class UsageRecordEntity {
    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "spool_id", nullable = false, updatable = false)
    private UUID spoolId;

    @Column(name = "amount_g", nullable = false, updatable = false)
    private double massGrams;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;

    @Column(name = "label", length = 1000)
    private String label;

    @Column(name = "category", nullable = false, length = 32)
    private String category;

    protected UsageRecordEntity() {
    }

    public static UsageRecordEntity from(UsageRecord record) {
        UsageRecordEntity entity = new UsageRecordEntity();
        entity.id = record.id();
        entity.spoolId = record.spoolId();
        entity.massGrams = record.massGrams();
        entity.recordedAt = record.recordedAt();
        entity.label = record.label();
        entity.category = record.category().wireValue();
        return entity;
    }

    public UsageRecord toDomain() {
        return new UsageRecord(id, spoolId, massGrams, recordedAt, label, UsageCategory.fromWire(category));
    }
}
