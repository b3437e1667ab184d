package com.example.filament_ledger.store;

import com.example.filament_ledger.ledger.LedgerSettings;
import com.example.filament_ledger.ledger.MaterialColor;
import com.example.filament_ledger.ledger.Spool;
import com.example.filament_ledger.ledger.UsageRecord;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Persistence boundary of the ledger. Each call is individually durable once it returns; nothing
 * here spans several entities in one transaction.
 *
 * <p>Ownership between a spool and its usage records is an explicit index
 * ({@link #usageIdsForSpool}); deleting a spool does not delete its records, callers fan the delete
 * out themselves.
 */
public interface InventoryStore {

    /* ---------- spools ---------- */

    Optional<Spool> findSpool(UUID id);

    List<Spool> allSpools();

    List<Spool> findSpools(Predicate<Spool> filter);

    List<Spool> activeSpools();

    List<Spool> archivedSpools();

    Spool createSpool(Spool spool);

    Spool updateSpool(Spool spool);

    void deleteSpool(UUID id);

    /* ---------- usage records ---------- */

    Optional<UsageRecord> findUsage(UUID id);

    List<UsageRecord> usageForSpool(UUID spoolId);

    List<UsageRecord> allUsage();

    List<UUID> usageIdsForSpool(UUID spoolId);

    UsageRecord createUsage(UsageRecord record);

    int deleteUsage(Collection<UUID> ids);

    /* ---------- material colors ---------- */

    List<MaterialColor> allColors();

    Optional<MaterialColor> findColor(String material);

    MaterialColor saveColor(MaterialColor color);

    void deleteAllColors();

    /* ---------- settings ---------- */

    Optional<LedgerSettings> findSettings();

    /**
     * Writes the single settings record, updating the existing row in place when there is one.
     */
    LedgerSettings saveSettings(LedgerSettings settings);
}
