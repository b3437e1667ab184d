package com.example.filament_ledger.dto.web;

import jakarta.validation.constraints.NotBlank;

public record MaterialColorRequest(@NotBlank String colorHex) {
}
