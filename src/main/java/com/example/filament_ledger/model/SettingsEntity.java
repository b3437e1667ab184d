package com.example.filament_ledger.model;

import com.example.filament_ledger.ledger.Language;
import com.example.filament_ledger.ledger.LedgerSettings;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.UuidGenerator;

import java.util.UUID;

@Entity
@Table(name = "app_settings")
public class SettingsEntity {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "default_diameter_mm", nullable = false)
    private double defaultDiameterMm;

    @Column(name = "low_stock_threshold", nullable = false)
    private double lowStockThreshold;

    @Column(name = "currency", nullable = false, length = 8)
    private String currency;

    @Column(name = "language", nullable = false, length = 16)
    private String language;

    protected SettingsEntity() {
    }

    public SettingsEntity(LedgerSettings settings) {
        apply(settings);
    }

    /**
     * Overwrites the fields in place; the row itself is never replaced.
     */
    public void apply(LedgerSettings settings) {
        this.defaultDiameterMm = settings.defaultDiameterMm();
        this.lowStockThreshold = settings.lowStockThreshold();
        this.currency = settings.currency();
        this.language = settings.language().code();
    }

    public LedgerSettings toDomain() {
        return new LedgerSettings(defaultDiameterMm, lowStockThreshold, currency, Language.fromCode(language));
    }
}
