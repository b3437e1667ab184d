package com.example.filament_ledger.service;

import com.example.filament_ledger.config.LedgerProperties;
import com.example.filament_ledger.ledger.LedgerException;
import com.example.filament_ledger.ledger.LedgerSettings;
import com.example.filament_ledger.ledger.SpoolLedger;
import com.example.filament_ledger.store.InventoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Owns the single settings record. The first read creates it from {@code ledger.defaults}.
 */
@Service
public class SettingsService {
    private static final Logger LOGGER = LoggerFactory.getLogger(SettingsService.class);
    public static final int MAX_CURRENCY_LENGTH = 8;

    private final InventoryStore store;
    private final LedgerProperties properties;

    public SettingsService(InventoryStore store, LedgerProperties properties) {
        this.store = store;
        this.properties = properties;
    }

    public LedgerSettings current() {
        return store.findSettings().orElseGet(() -> {
            LedgerSettings defaults = properties.getDefaults().toSettings();
            LOGGER.info("SettingsService creating default settings threshold={} diameter={}",
                    defaults.lowStockThreshold(), defaults.defaultDiameterMm());
            return store.saveSettings(defaults);
        });
    }

    public LedgerSettings update(LedgerSettings settings) {
        validate(settings);
        LedgerSettings saved = store.saveSettings(settings);
        LOGGER.info("SettingsService update threshold={} diameter={} currency={} language={}",
                saved.lowStockThreshold(), saved.defaultDiameterMm(), saved.currency(), saved.language().code());
        return saved;
    }

    /**
     * Rules every stored settings record satisfies, whether it comes from the API or an import.
     *
     * @throws LedgerException INVALID_INPUT naming the first broken rule
     */
    public static void validate(LedgerSettings settings) {
        if (settings == null) {
            throw LedgerException.invalidInput("Settings are required");
        }
        if (!SpoolLedger.isStandardDiameter(settings.defaultDiameterMm())) {
            throw LedgerException.invalidInput("Default diameter " + settings.defaultDiameterMm()
                    + " mm is not one of " + SpoolLedger.STANDARD_DIAMETERS_MM);
        }
        if (settings.lowStockThreshold() < 0 || settings.lowStockThreshold() > 100) {
            throw LedgerException.invalidInput("Low-stock threshold must be between 0 and 100, got "
                    + settings.lowStockThreshold());
        }
        if (settings.currency() == null || settings.currency().isBlank()) {
            throw LedgerException.invalidInput("Currency symbol is required");
        }
        if (settings.currency().length() > MAX_CURRENCY_LENGTH) {
            throw LedgerException.invalidInput("Currency symbol is limited to " + MAX_CURRENCY_LENGTH
                    + " characters, got '" + settings.currency() + "'");
        }
        if (settings.language() == null) {
            throw LedgerException.invalidInput("Language is required");
        }
    }
}
