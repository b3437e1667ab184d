package com.example.filament_ledger.model;

import com.example.filament_ledger.ledger.Spool;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Row form of {@link Spool}. Identity is assigned by the ledger, never generated here.
 */
@Entity
@Table(name = "spool")
public class SpoolEntity {
    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "brand", nullable = false)
    private String brand;

    @Column(name = "material", nullable = false, length = 100)
    private String material;

    @Column(name = "color_name", nullable = false)
    private String colorName;

    @Column(name = "color_hex", nullable = false, length = 7)
    private String colorHex;

    @Column(name = "diameter_mm", nullable = false)
    private double diameterMm;

    @Column(name = "initial_mass_g", nullable = false)
    private double initialMassGrams;

    @Column(name = "remaining_mass_g", nullable = false)
    private double remainingMassGrams;

    @Column(name = "tare_mass_g")
    private Double tareMassGrams;

    @Column(name = "density_g_cm3")
    private Double densityOverride;

    @Column(name = "min_temp_c")
    private Integer minTempC;

    @Column(name = "max_temp_c")
    private Integer maxTempC;

    @Column(name = "bed_temp_c")
    private Integer bedTempC;

    @Column(name = "price", precision = 19, scale = 4)
    private BigDecimal price;

    @Column(name = "acquired_at", nullable = false)
    private Instant acquiredAt;

    @Column(name = "archived", nullable = false)
    private boolean archived;

    @Column(name = "notes", length = 4000)
    private String notes;

    protected SpoolEntity() {
    }

    public SpoolEntity(UUID id) {
        this.id = id;
    }

    public static SpoolEntity from(Spool spool) {
        SpoolEntity entity = new SpoolEntity(spool.id());
        entity.apply(spool);
        return entity;
    }

    /**
     * Copies every mutable attribute of the snapshot onto this row.
     */
    public void apply(Spool spool) {
        this.brand = spool.brand();
        this.material = spool.material();
        this.colorName = spool.colorName();
        this.colorHex = spool.colorHex();
        this.diameterMm = spool.diameterMm();
        this.initialMassGrams = spool.initialMassGrams();
        this.remainingMassGrams = spool.remainingMassGrams();
        this.tareMassGrams = spool.tareMassGrams();
        this.densityOverride = spool.densityOverride();
        this.minTempC = spool.minTempC();
        this.maxTempC = spool.maxTempC();
        this.bedTempC = spool.bedTempC();
        this.price = spool.price();
        this.acquiredAt = spool.acquiredAt();
        this.archived = spool.archived();
        this.notes = spool.notes();
    }

    public Spool toDomain() {
        return new Spool(id, brand, material, colorName, colorHex, diameterMm, initialMassGrams,
                remainingMassGrams, tareMassGrams, densityOverride, minTempC, maxTempC, bedTempC, price,
                acquiredAt, archived, notes);
    }
}
