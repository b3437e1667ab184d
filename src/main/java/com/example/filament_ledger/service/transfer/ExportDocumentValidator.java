package com.example.filament_ledger.service.transfer;

import com.example.filament_ledger.ledger.HexColor;
import com.example.filament_ledger.ledger.LedgerException;
import com.example.filament_ledger.ledger.LedgerSettings;
import com.example.filament_ledger.ledger.SpoolLedger;
import com.example.filament_ledger.service.SettingsService;
import com.example.filament_ledger.service.transfer.ExportDocument.MaterialColorDocument;
import com.example.filament_ledger.service.transfer.ExportDocument.SettingsDocument;
import com.example.filament_ledger.service.transfer.ExportDocument.SpoolDocument;
import com.example.filament_ledger.service.transfer.ExportDocument.UsageDocument;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Structural and semantic checks on an import document. Collects every violation instead of
 * stopping at the first one so the user can fix the file in one go.
 */
@Component
public class ExportDocumentValidator {
    static final String SUPPORTED_MAJOR_VERSION = "1";

    // column sizes of V1__ledger_schema.sql
    static final int MAX_NAME_LENGTH = 255;
    static final int MAX_MATERIAL_LENGTH = 100;
    static final int MAX_NOTES_LENGTH = 4000;
    static final int MAX_LABEL_LENGTH = 1000;
    static final int MAX_PRICE_SCALE = 4;
    static final int MAX_PRICE_INTEGER_DIGITS = 15;

    private final SpoolLedger ledger;

    public ExportDocumentValidator(SpoolLedger ledger) {
        this.ledger = ledger;
    }

    /**
     * @param current settings an import would overwrite; fills the fields the document leaves out
     * @return every violation found, empty when the document can be applied
     */
    public List<String> validate(ExportDocument doc, LedgerSettings current) {
        List<String> violations = new ArrayList<>();
        if (doc == null) {
            violations.add("document is empty");
            return violations;
        }
        checkVersion(doc.version(), violations);

        Set<UUID> spoolIds = new HashSet<>();
        Set<UUID> usageIds = new HashSet<>();
        List<SpoolDocument> spools = doc.filaments() == null ? List.of() : doc.filaments();
        for (int i = 0; i < spools.size(); i++) {
            SpoolDocument spool = spools.get(i);
            String where = "filaments[" + i + "]";
            if (spool == null) {
                violations.add(where + ": entry is empty");
                continue;
            }
            checkSpool(spool, where, violations);
            if (spool.id() != null && !spoolIds.add(spool.id())) {
                violations.add(where + ": duplicate spool id " + spool.id());
            }
            List<UsageDocument> logs = spool.logs() == null ? List.of() : spool.logs();
            for (int j = 0; j < logs.size(); j++) {
                checkUsage(logs.get(j), where + ".logs[" + j + "]", usageIds, violations);
            }
        }

        List<MaterialColorDocument> colors = doc.materialColorConfigs() == null ? List.of() : doc.materialColorConfigs();
        for (int i = 0; i < colors.size(); i++) {
            MaterialColorDocument color = colors.get(i);
            String where = "materialColorConfigs[" + i + "]";
            if (color == null || color.material() == null || color.material().isBlank()) {
                violations.add(where + ": material is required");
            } else if (color.material().trim().length() > MAX_MATERIAL_LENGTH) {
                violations.add(where + ": material is longer than " + MAX_MATERIAL_LENGTH + " characters");
            } else if (!HexColor.isValid(color.colorHex())) {
                violations.add(where + ": color " + color.colorHex() + " is not a 6-digit hex value");
            }
        }

        checkSettings(doc.appSettings(), current, violations);
        return violations;
    }

    private static void checkVersion(String version, List<String> violations) {
        if (version == null || version.isBlank()) {
            violations.add("version is required");
            return;
        }
        String major = version.trim().split("\\.", 2)[0];
        if (!SUPPORTED_MAJOR_VERSION.equals(major)) {
            violations.add("version " + version + " is not supported, expected 1.x");
        }
    }

    private void checkSpool(SpoolDocument spool, String where, List<String> violations) {
        if (spool.id() == null) {
            violations.add(where + ": id is required");
        }
        if (spool.initialWeight() == null) {
            violations.add(where + ": initialWeight is required");
        }
        if (spool.remainingWeight() == null) {
            violations.add(where + ": remainingWeight is required");
        }
        if (spool.diameter() == null) {
            violations.add(where + ": diameter is required");
        }
        if (spool.purchaseDate() == null) {
            violations.add(where + ": purchaseDate is required");
        }
        if (spool.colorHex() != null && !HexColor.isValid(spool.colorHex())) {
            violations.add(where + ": color " + spool.colorHex() + " is not a 6-digit hex value");
        }
        checkLength(spool.brand(), MAX_NAME_LENGTH, where + ".brand", violations);
        checkLength(spool.material(), MAX_MATERIAL_LENGTH, where + ".material", violations);
        checkLength(spool.colorName(), MAX_NAME_LENGTH, where + ".colorName", violations);
        checkLength(spool.notes(), MAX_NOTES_LENGTH, where + ".notes", violations);
        checkPrice(spool.price(), where, violations);
        if (spool.id() == null || spool.initialWeight() == null || spool.remainingWeight() == null || spool.diameter() == null) {
            return;
        }
        try {
            ledger.admit(ExportDocumentMapper.toSpool(spool));
        } catch (LedgerException ex) {
            violations.add(where + ": " + ex.getMessage());
        }
    }

    private static void checkUsage(UsageDocument usage, String where, Set<UUID> seen, List<String> violations) {
        if (usage == null) {
            violations.add(where + ": entry is empty");
            return;
        }
        if (usage.id() == null) {
            violations.add(where + ": id is required");
        } else if (!seen.add(usage.id())) {
            violations.add(where + ": duplicate usage record id " + usage.id());
        }
        if (usage.amount() == null || !(usage.amount() > 0)) {
            violations.add(where + ": amount must be greater than zero, got " + usage.amount());
        }
        if (usage.date() == null) {
            violations.add(where + ": date is required");
        }
        checkLength(usage.note(), MAX_LABEL_LENGTH, where + ".note", violations);
    }

    private static void checkLength(String value, int max, String where, List<String> violations) {
        if (value != null && value.trim().length() > max) {
            violations.add(where + " is longer than " + max + " characters");
        }
    }

    private static void checkPrice(BigDecimal price, String where, List<String> violations) {
        if (price == null) {
            return;
        }
        if (price.signum() < 0) {
            violations.add(where + ": price cannot be negative, got " + price.toPlainString());
        }
        BigDecimal stripped = price.stripTrailingZeros();
        if (stripped.scale() > MAX_PRICE_SCALE) {
            violations.add(where + ": price " + price.toPlainString() + " has more than " + MAX_PRICE_SCALE + " decimal places");
        } else if (stripped.precision() - stripped.scale() > MAX_PRICE_INTEGER_DIGITS) {
            violations.add(where + ": price " + price.toPlainString() + " is too large");
        }
    }

    private static void checkSettings(SettingsDocument settings, LedgerSettings current, List<String> violations) {
        if (settings == null) {
            return;
        }
        try {
            SettingsService.validate(ExportDocumentMapper.toSettings(settings, current));
        } catch (LedgerException ex) {
            violations.add("appSettings: " + ex.getMessage());
        }
    }
}
