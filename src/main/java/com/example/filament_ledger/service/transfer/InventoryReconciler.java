package com.example.filament_ledger.service.transfer;

import com.example.filament_ledger.config.LedgerProperties;
import com.example.filament_ledger.ledger.LedgerSettings;
import com.example.filament_ledger.ledger.MaterialColor;
import com.example.filament_ledger.ledger.Spool;
import com.example.filament_ledger.service.SettingsService;
import com.example.filament_ledger.service.transfer.ExportDocument.MaterialColorDocument;
import com.example.filament_ledger.service.transfer.ExportDocument.SpoolDocument;
import com.example.filament_ledger.service.transfer.ExportDocument.UsageDocument;
import com.example.filament_ledger.store.InventoryStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Whole-inventory export and import.
 *
 * <p>An import validates the complete document before the first write; a rejected document leaves
 * the store untouched. Writes then happen one entity at a time without an enclosing transaction, so a
 * failing write stops the run and reports how far it got through {@link ImportFailedException}.
 */
@Service
public class InventoryReconciler {
    private static final Logger LOGGER = LoggerFactory.getLogger(InventoryReconciler.class);

    private final InventoryStore store;
    private final SettingsService settingsService;
    private final ExportDocumentValidator validator;
    private final LedgerProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public InventoryReconciler(InventoryStore store,
                               SettingsService settingsService,
                               ExportDocumentValidator validator,
                               LedgerProperties properties,
                               ObjectMapper objectMapper,
                               Clock clock) {
        this.store = store;
        this.settingsService = settingsService;
        this.validator = validator;
        this.properties = properties;
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
        this.clock = clock;
    }

    /* ---------- EXPORT ---------- */

    public ExportDocument export() {
        List<SpoolDocument> spools = store.allSpools().stream()
                .sorted(Comparator.comparing(Spool::acquiredAt, Comparator.nullsLast(Comparator.reverseOrder())))
                .map(s -> ExportDocumentMapper.toDocument(s, store.usageForSpool(s.id())))
                .toList();
        List<MaterialColorDocument> colors = store.allColors().stream()
                .map(ExportDocumentMapper::toDocument)
                .toList();
        ExportDocument doc = new ExportDocument(properties.getExportVersion(), clock.instant(), spools, colors,
                ExportDocumentMapper.toDocument(settingsService.current()));
        LOGGER.info("InventoryReconciler export spools={} colors={}", spools.size(), colors.size());
        return doc;
    }

    public String exportJson() {
        try {
            return objectMapper.writeValueAsString(export());
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Could not serialize export document", ex);
        }
    }

    /* ---------- IMPORT ---------- */

    /**
     * Parses an export file. Syntax errors, wrong value types and malformed identities are all
     * reported as a schema violation.
     */
    public ExportDocument parse(String json) {
        if (json == null || json.isBlank()) {
            throw new SchemaInvalidException(List.of("document is empty"));
        }
        try {
            return objectMapper.readValue(json, ExportDocument.class);
        } catch (JsonProcessingException ex) {
            throw new SchemaInvalidException(ex.getOriginalMessage(), ex);
        }
    }

    public ImportResult importJson(String json, ImportPolicy policy) {
        return importDocument(parse(json), policy);
    }

    public ImportResult importDocument(ExportDocument doc, ImportPolicy policy) {
        ImportRun run = new ImportRun(policy == null ? ImportPolicy.MERGE : policy);
        run.transition(ImportState.VALIDATING);
        List<String> violations = validator.validate(doc, currentSettings());
        if (!violations.isEmpty()) {
            run.transition(ImportState.FAILED);
            LOGGER.warn("InventoryReconciler import rejected policy={} violations={}", run.policy, violations.size());
            throw new SchemaInvalidException(violations);
        }

        if (run.policy == ImportPolicy.REPLACE) {
            run.transition(ImportState.APPLYING_REPLACE);
        } else {
            run.transition(ImportState.APPLYING_MERGE);
        }
        try {
            ImportPlan plan = plan(doc, run);
            if (run.policy == ImportPolicy.REPLACE) {
                clearInventory();
            }
            for (SpoolDocument spoolDoc : plan.spools) {
                Spool spool = store.createSpool(ExportDocumentMapper.toSpool(spoolDoc));
                run.written++;
                run.spoolsCreated++;
                for (UsageDocument usage : logsOf(spoolDoc)) {
                    if (plan.skippedUsage.contains(usage.id())) {
                        continue;
                    }
                    store.createUsage(ExportDocumentMapper.toUsage(usage, spool));
                    run.written++;
                    run.usageCreated++;
                }
            }
            for (MaterialColor color : plan.colors) {
                store.saveColor(color);
                run.written++;
                run.colorsCreated++;
            }
            if (plan.settings != null) {
                store.saveSettings(plan.settings);
                run.written++;
                run.settingsUpdated = true;
            }
        } catch (DataAccessException ex) {
            run.transition(ImportState.FAILED);
            LOGGER.error("InventoryReconciler import failed policy={} written={} total={}",
                    run.policy, run.written, run.total, ex);
            throw new ImportFailedException(run.policy, run.written, run.total, ex);
        }
        run.transition(ImportState.COMMITTED);
        LOGGER.info("InventoryReconciler import committed policy={} spools={} usage={} colors={} skipped={}",
                run.policy, run.spoolsCreated, run.usageCreated, run.colorsCreated,
                run.spoolsSkipped + run.usageSkipped + run.colorsSkipped);
        return run.toResult();
    }

    /**
     * Decides what will be written before the first write, so the total is known up front.
     */
    private ImportPlan plan(ExportDocument doc, ImportRun run) {
        boolean merge = run.policy == ImportPolicy.MERGE;
        ImportPlan plan = new ImportPlan();
        for (SpoolDocument spool : doc.filaments() == null ? List.<SpoolDocument>of() : doc.filaments()) {
            if (merge && store.findSpool(spool.id()).isPresent()) {
                run.spoolsSkipped++;
                continue;
            }
            plan.spools.add(spool);
            run.total++;
            for (UsageDocument usage : logsOf(spool)) {
                if (merge && store.findUsage(usage.id()).isPresent()) {
                    plan.skippedUsage.add(usage.id());
                    run.usageSkipped++;
                } else {
                    run.total++;
                }
            }
        }

        Set<String> seen = new HashSet<>();
        List<MaterialColorDocument> colors = doc.materialColorConfigs() == null ? List.of() : doc.materialColorConfigs();
        for (MaterialColorDocument colorDoc : colors) {
            MaterialColor color = ExportDocumentMapper.toColor(colorDoc);
            // first entry wins for names that differ only in case
            if (!seen.add(color.key()) || (merge && store.findColor(color.material()).isPresent())) {
                run.colorsSkipped++;
                continue;
            }
            plan.colors.add(color);
            run.total++;
        }

        if (doc.appSettings() != null) {
            plan.settings = ExportDocumentMapper.toSettings(doc.appSettings(), currentSettings());
            run.total++;
        }
        return plan;
    }

    /**
     * Stored settings, or the configured defaults when none exist yet. Reads only.
     */
    private LedgerSettings currentSettings() {
        return store.findSettings().orElseGet(() -> properties.getDefaults().toSettings());
    }

    private void clearInventory() {
        List<Spool> existing = store.allSpools();
        int usageRemoved = 0;
        for (Spool spool : existing) {
            usageRemoved += store.deleteUsage(store.usageIdsForSpool(spool.id()));
            store.deleteSpool(spool.id());
        }
        store.deleteAllColors();
        LOGGER.info("InventoryReconciler cleared spools={} usage={}", existing.size(), usageRemoved);
    }

    private static List<UsageDocument> logsOf(SpoolDocument spool) {
        return spool.logs() == null ? List.of() : spool.logs();
    }

    private static final class ImportPlan {
        private final List<SpoolDocument> spools = new ArrayList<>();
        private final Set<UUID> skippedUsage = new HashSet<>();
        private final List<MaterialColor> colors = new ArrayList<>();
        private LedgerSettings settings;
    }

    private static final class ImportRun {
        private final ImportPolicy policy;
        private ImportState state = ImportState.IDLE;
        private int total;
        private int written;
        private int spoolsCreated;
        private int spoolsSkipped;
        private int usageCreated;
        private int usageSkipped;
        private int colorsCreated;
        private int colorsSkipped;
        private boolean settingsUpdated;

        private ImportRun(ImportPolicy policy) {
            this.policy = policy;
        }

        void transition(ImportState next) {
            LOGGER.debug("InventoryReconciler import state {} -> {} policy={}", state, next, policy);
            state = next;
        }

        ImportResult toResult() {
            return new ImportResult(policy, state, spoolsCreated, spoolsSkipped, usageCreated, usageSkipped,
                    colorsCreated, colorsSkipped, settingsUpdated, written);
        }
    }
}
