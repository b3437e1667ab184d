package com.example.filament_ledger.service.transfer;

public enum ImportState {
    IDLE,
    VALIDATING,
    APPLYING_REPLACE,
    APPLYING_MERGE,
    COMMITTED,
    FAILED
}
