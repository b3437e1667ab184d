package com.example.filament_ledger;

import com.example.filament_ledger.ledger.Spool;
import com.example.filament_ledger.ledger.SpoolDraft;
import com.example.filament_ledger.service.MaterialColorRegistry;
import com.example.filament_ledger.service.SpoolService;
import com.example.filament_ledger.service.UsageRecorder;
import com.example.filament_ledger.service.UsageRecorder.UsageEntry;
import com.example.filament_ledger.service.transfer.ImportPolicy;
import com.example.filament_ledger.service.transfer.ImportResult;
import com.example.filament_ledger.service.transfer.InventoryReconciler;
import com.example.filament_ledger.store.InventoryStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "spring.datasource.url=jdbc:h2:mem:ledger-it;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE",
        "recognition.enabled=false"
})
class FilamentLedgerApplicationTests {

    @Autowired
    private MaterialColorRegistry registry;

    @Autowired
    private SpoolService spoolService;

    @Autowired
    private UsageRecorder usageRecorder;

    @Autowired
    private InventoryReconciler reconciler;

    @Autowired
    private InventoryStore store;

    @Test
    void stockConsumeExportAndReimport() {
        assertThat(registry.list()).hasSizeGreaterThanOrEqualTo(MaterialColorRegistry.DEFAULT_MATERIALS.size());

        Spool spool = spoolService.create(new SpoolDraft("Overture", "PLA", "Space Grey", "#4A4A4A", null, 1000,
                null, null, null, null, null, null, null, null));
        usageRecorder.recordUsage(List.of(new UsageEntry(spool.id(), 1200, "Vase", null, null)));

        Spool emptied = spoolService.get(spool.id());
        assertThat(emptied.remainingMassGrams()).isZero();
        assertThat(emptied.archived()).isTrue();

        String json = reconciler.exportJson();
        ImportResult again = reconciler.importJson(json, ImportPolicy.MERGE);

        assertThat(again.spoolsCreated()).isZero();
        assertThat(store.usageForSpool(spool.id())).hasSize(1);

        spoolService.delete(spool.id());
        assertThat(store.usageIdsForSpool(spool.id())).isEmpty();
    }
}
