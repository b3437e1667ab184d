package com.example.filament_ledger.service.transfer;

import com.example.filament_ledger.ledger.HexColor;
import com.example.filament_ledger.ledger.Language;
import com.example.filament_ledger.ledger.LedgerSettings;
import com.example.filament_ledger.ledger.MaterialColor;
import com.example.filament_ledger.ledger.Spool;
import com.example.filament_ledger.ledger.UsageCategory;
import com.example.filament_ledger.ledger.UsageRecord;
import com.example.filament_ledger.service.transfer.ExportDocument.MaterialColorDocument;
import com.example.filament_ledger.service.transfer.ExportDocument.SettingsDocument;
import com.example.filament_ledger.service.transfer.ExportDocument.SpoolDocument;
import com.example.filament_ledger.service.transfer.ExportDocument.UsageDocument;

import java.util.List;

/**
 * Converts between ledger records and the export document shape. Reading assumes the document
 * passed {@link ExportDocumentValidator}.
 */
final class ExportDocumentMapper {

    private ExportDocumentMapper() {
    }

    static SpoolDocument toDocument(Spool spool, List<UsageRecord> records) {
        return new SpoolDocument(
                spool.id(),
                spool.brand(),
                spool.material(),
                spool.colorName(),
                spool.colorHex(),
                spool.diameterMm(),
                spool.initialMassGrams(),
                spool.remainingMassGrams(),
                spool.tareMassGrams(),
                spool.densityOverride(),
                spool.minTempC(),
                spool.maxTempC(),
                spool.bedTempC(),
                spool.price(),
                spool.acquiredAt(),
                spool.archived(),
                spool.notes(),
                records.stream().map(ExportDocumentMapper::toDocument).toList());
    }

    static UsageDocument toDocument(UsageRecord record) {
        return new UsageDocument(record.id(), record.massGrams(), record.recordedAt(), record.label(),
                record.category().wireValue());
    }

    static MaterialColorDocument toDocument(MaterialColor color) {
        return new MaterialColorDocument(color.material(), color.colorHex());
    }

    static SettingsDocument toDocument(LedgerSettings settings) {
        return new SettingsDocument(settings.defaultDiameterMm(), settings.lowStockThreshold(),
                settings.currency(), settings.language().code());
    }

    static Spool toSpool(SpoolDocument doc) {
        String hex = doc.colorHex() == null ? HexColor.DEFAULT_SPOOL_COLOR : HexColor.normalize(doc.colorHex());
        return new Spool(
                doc.id(),
                nullToEmpty(doc.brand()),
                nullToEmpty(doc.material()),
                nullToEmpty(doc.colorName()),
                hex,
                valueOrZero(doc.diameter()),
                valueOrZero(doc.initialWeight()),
                valueOrZero(doc.remainingWeight()),
                doc.emptySpoolWeight(),
                doc.density(),
                doc.minTemp(),
                doc.maxTemp(),
                doc.bedTemp(),
                doc.price(),
                doc.purchaseDate(),
                doc.archived(),
                doc.notes() == null || doc.notes().isBlank() ? null : doc.notes());
    }

    static UsageRecord toUsage(UsageDocument doc, Spool owner) {
        return new UsageRecord(doc.id(), owner.id(), doc.amount(), doc.date(), doc.note(),
                UsageCategory.fromWire(doc.type()));
    }

    static MaterialColor toColor(MaterialColorDocument doc) {
        return new MaterialColor(doc.material().trim(), HexColor.normalize(doc.colorHex()));
    }

    static LedgerSettings toSettings(SettingsDocument doc, LedgerSettings fallback) {
        return new LedgerSettings(
                doc.defaultDiameter() != null ? doc.defaultDiameter() : fallback.defaultDiameterMm(),
                doc.lowStockThreshold() != null ? doc.lowStockThreshold() : fallback.lowStockThreshold(),
                doc.currency() != null && !doc.currency().isBlank() ? doc.currency() : fallback.currency(),
                doc.language() != null && !doc.language().isBlank() ? Language.fromCode(doc.language()) : fallback.language());
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value.trim();
    }

    private static double valueOrZero(Double value) {
        return value == null ? 0 : value;
    }
}
