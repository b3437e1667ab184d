package com.example.filament_ledger.dto.web;

import com.example.filament_ledger.ledger.MaterialColor;

public record MaterialColorResponse(String material, String colorHex) {
    public static MaterialColorResponse from(MaterialColor c) {
        return new MaterialColorResponse(c.material(), c.colorHex());
    }
}
