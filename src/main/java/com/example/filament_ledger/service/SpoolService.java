package com.example.filament_ledger.service;

import com.example.filament_ledger.ledger.LedgerException;
import com.example.filament_ledger.ledger.LedgerSettings;
import com.example.filament_ledger.ledger.Spool;
import com.example.filament_ledger.ledger.SpoolDetails;
import com.example.filament_ledger.ledger.SpoolDraft;
import com.example.filament_ledger.ledger.SpoolLedger;
import com.example.filament_ledger.ledger.UsageRecord;
import com.example.filament_ledger.store.InventoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Spool lifecycle: create, edit, archive/restore and delete. Quantity rules live in
 * {@link SpoolLedger}; this class loads, transitions and stores.
 */
@Service
public class SpoolService {
    private static final Logger LOGGER = LoggerFactory.getLogger(SpoolService.class);

    private final InventoryStore store;
    private final SpoolLedger ledger;
    private final MaterialColorRegistry colorRegistry;
    private final SettingsService settingsService;

    public SpoolService(InventoryStore store,
                        SpoolLedger ledger,
                        MaterialColorRegistry colorRegistry,
                        SettingsService settingsService) {
        this.store = store;
        this.ledger = ledger;
        this.colorRegistry = colorRegistry;
        this.settingsService = settingsService;
    }

    /* ---------- CREATE ---------- */

    public Spool create(SpoolDraft draft) {
        Spool spool = ledger.create(draft, settingsService.current());
        colorRegistry.colorFor(spool.material());
        Spool saved = store.createSpool(spool);
        LOGGER.info("SpoolService create id={} material={} initial={}", saved.id(), saved.material(), saved.initialMassGrams());
        return saved;
    }

    /* ---------- READ ---------- */

    public Spool get(UUID spoolId) {
        return store.findSpool(spoolId).orElseThrow(() -> LedgerException.unknownSpool(spoolId));
    }

    public List<Spool> list(SpoolFilter filter, String material) {
        List<Spool> spools = switch (filter == null ? SpoolFilter.ACTIVE : filter) {
            case ACTIVE -> store.activeSpools();
            case ARCHIVED -> store.archivedSpools();
            case ALL -> store.allSpools();
        };
        if (material == null || material.isBlank()) {
            return spools;
        }
        String wanted = material.trim();
        return spools.stream().filter(s -> s.material().equalsIgnoreCase(wanted)).toList();
    }

    /**
     * Active spools below the configured low-stock threshold, emptiest first.
     */
    public List<Spool> lowStock() {
        double threshold = settingsService.current().lowStockThreshold();
        return store.findSpools(s -> !s.archived() && s.isLowStock(threshold)).stream()
                .sorted(Comparator.comparingDouble(Spool::remainingPercentage))
                .toList();
    }

    public List<UsageRecord> usageHistory(UUID spoolId) {
        get(spoolId);
        return store.usageForSpool(spoolId);
    }

    public LedgerSettings settings() {
        return settingsService.current();
    }

    /* ---------- UPDATE ---------- */

    /**
     * Applies descriptive edits and, when {@code newInitialMass} is given, restates the stock while
     * preserving what was already consumed.
     */
    public Spool edit(UUID spoolId, SpoolDetails details, Double newInitialMass) {
        Spool current = get(spoolId);
        Spool next = details != null ? ledger.edit(current, details) : current;
        if (newInitialMass != null) {
            next = ledger.reviseStock(next, newInitialMass);
        }
        if (details != null && details.material() != null) {
            colorRegistry.colorFor(next.material());
        }
        Spool saved = store.updateSpool(next);
        LOGGER.info("SpoolService edit id={} initial={} remaining={}", saved.id(), saved.initialMassGrams(), saved.remainingMassGrams());
        return saved;
    }

    public Spool correctRemaining(UUID spoolId, double newRemaining) {
        Spool next = ledger.correctRemaining(get(spoolId), newRemaining);
        Spool saved = store.updateSpool(next);
        LOGGER.info("SpoolService correctRemaining id={} remaining={} archived={}", saved.id(), saved.remainingMassGrams(), saved.archived());
        return saved;
    }

    public Spool archive(UUID spoolId) {
        Spool saved = store.updateSpool(ledger.archive(get(spoolId)));
        LOGGER.info("SpoolService archive id={}", spoolId);
        return saved;
    }

    public Spool restore(UUID spoolId) {
        Spool saved = store.updateSpool(ledger.restore(get(spoolId)));
        LOGGER.info("SpoolService restore id={}", spoolId);
        return saved;
    }

    /* ---------- DELETE ---------- */

    /**
     * Permanently deletes a spool and every usage record it owns. Records go first so that a failure
     * in between never leaves records pointing at a deleted spool.
     */
    public void delete(UUID spoolId) {
        get(spoolId);
        List<UUID> usageIds = store.usageIdsForSpool(spoolId);
        int removed = store.deleteUsage(usageIds);
        store.deleteSpool(spoolId);
        LOGGER.info("SpoolService delete id={} usageRecords={}", spoolId, removed);
    }

    public enum SpoolFilter {
        ACTIVE, ARCHIVED, ALL
    }
}
