package com.example.filament_ledger.config;

import com.example.filament_ledger.ledger.Language;
import com.example.filament_ledger.ledger.LedgerSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Ledger configuration: export document version and the values the settings record starts with.
 */
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {
    private String exportVersion = "1.0";
    private Defaults defaults = new Defaults();

    public String getExportVersion() {
        return exportVersion;
    }

    public void setExportVersion(String exportVersion) {
        this.exportVersion = exportVersion;
    }

    public Defaults getDefaults() {
        return defaults;
    }

    public void setDefaults(Defaults defaults) {
        this.defaults = defaults;
    }

    public static class Defaults {
        private double defaultDiameterMm = 1.75;
        private double lowStockThreshold = 20.0;
        private String currency = "$";
        private String language = Language.SYSTEM.code();

        public double getDefaultDiameterMm() {
            return defaultDiameterMm;
        }

        public void setDefaultDiameterMm(double defaultDiameterMm) {
            this.defaultDiameterMm = defaultDiameterMm;
        }

        public double getLowStockThreshold() {
            return lowStockThreshold;
        }

        public void setLowStockThreshold(double lowStockThreshold) {
            this.lowStockThreshold = lowStockThreshold;
        }

        public String getCurrency() {
            return currency;
        }

        public void setCurrency(String currency) {
            this.currency = currency;
        }

        public String getLanguage() {
            return language;
        }

        public void setLanguage(String language) {
            this.language = language;
        }

        public LedgerSettings toSettings() {
            return new LedgerSettings(defaultDiameterMm, lowStockThreshold, currency, Language.fromCode(language));
        }
    }
}
