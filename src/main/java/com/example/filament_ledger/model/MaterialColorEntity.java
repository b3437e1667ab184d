package com.example.filament_ledger.model;

import com.example.filament_ledger.ledger.MaterialColor;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Material→color binding keyed by the lower-cased material name, which enforces one entry per
 * case-insensitive material.
 */
@Entity
@Table(name = "material_color")
public class MaterialColorEntity {
    @Id
    @Column(name = "material_key", nullable = false, updatable = false, length = 100)
    private String materialKey;

    @Column(name = "material", nullable = false, length = 100)
    private String material;

    @Column(name = "color_hex", nullable = false, length = 7)
    private String colorHex;

    protected MaterialColorEntity() {
    }

    public static MaterialColorEntity from(MaterialColor color) {
        MaterialColorEntity entity = new MaterialColorEntity();
        entity.materialKey = color.key();
        entity.material = color.material().trim();
        entity.colorHex = color.colorHex();
        return entity;
    }

    public MaterialColor toDomain() {
        return new MaterialColor(material, colorHex);
    }

    public void setColorHex(String colorHex) {
        this.colorHex = colorHex;
    }
}
