package com.example.filament_ledger.dto.web;

public record ConversionResponse(double lengthMeters, double massGrams, double diameterMm, double density) {
}
