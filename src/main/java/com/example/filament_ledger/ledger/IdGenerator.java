package com.example.filament_ledger.ledger;

import java.util.UUID;

/**
 * Source of new entity identities.
 */
@FunctionalInterface
public interface IdGenerator {
    UUID next();

    static IdGenerator random() {
        return UUID::randomUUID;
    }
}
