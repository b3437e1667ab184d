package com.example.filament_ledger.store;

import com.example.filament_ledger.ledger.Language;
import com.example.filament_ledger.ledger.LedgerSettings;
import com.example.filament_ledger.ledger.MaterialColor;
import com.example.filament_ledger.ledger.Spool;
import com.example.filament_ledger.ledger.UsageCategory;
import com.example.filament_ledger.ledger.UsageRecord;
import com.example.filament_ledger.model.SpoolEntity;
import com.example.filament_ledger.repository.SettingsRepository;
import com.example.filament_ledger.repository.SpoolRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DataJpaTest
@Import(JpaInventoryStore.class)
class JpaInventoryStoreTest {
    private static final Instant ACQUIRED = Instant.parse("2024-02-01T10:15:30Z");

    @Autowired
    private JpaInventoryStore store;

    @Autowired
    private SpoolRepository spoolRepository;

    @Autowired
    private SettingsRepository settingsRepository;

    @Autowired
    private TestEntityManager entityManager;

    private static Spool spool(double initial, double remaining, boolean archived) {
        return new Spool(UUID.randomUUID(), "Sunlu", "PLA", "Grey", "#808080", 1.75, initial, remaining, 180.0,
                null, 200, 220, 55, new BigDecimal("19.99"), ACQUIRED, archived, "matte");
    }

    @Test
    void spoolRoundTripsWithAssignedIdentity() {
        Spool spool = spool(1000, 640, false);

        store.createSpool(spool);

        Spool loaded = store.findSpool(spool.id()).orElseThrow();
        assertThat(loaded.id()).isEqualTo(spool.id());
        assertThat(loaded.remainingMassGrams()).isEqualTo(640);
        assertThat(loaded.price()).isEqualByComparingTo("19.99");
        assertThat(loaded.acquiredAt()).isEqualTo(ACQUIRED);
        assertThat(loaded.notes()).isEqualTo("matte");
    }

    @Test
    void priceWithFourDecimalsSurvivesTheDatabase() {
        Spool spool = spool(1000, 1000, false);
        Spool priced = new Spool(spool.id(), spool.brand(), spool.material(), spool.colorName(), spool.colorHex(),
                spool.diameterMm(), 1000, 1000, null, null, null, null, null, new BigDecimal("123456789012345.6789"),
                ACQUIRED, false, null);

        store.createSpool(priced);
        entityManager.flush();
        entityManager.clear();

        assertThat(store.findSpool(spool.id()).orElseThrow().price()).isEqualByComparingTo("123456789012345.6789");
    }

    @Test
    void creatingExistingIdIsRejected() {
        Spool spool = store.createSpool(spool(1000, 1000, false));

        assertThrows(DuplicateKeyException.class, () -> store.createSpool(spool));
    }

    @Test
    void activeAndArchivedAreSeparated() {
        Spool active = store.createSpool(spool(1000, 500, false));
        Spool archived = store.createSpool(spool(1000, 0, true));

        assertThat(store.activeSpools()).extracting(Spool::id).containsExactly(active.id());
        assertThat(store.archivedSpools()).extracting(Spool::id).containsExactly(archived.id());
    }

    @Test
    void ownershipIndexDrivesUsageDeletion() {
        Spool a = store.createSpool(spool(1000, 1000, false));
        Spool b = store.createSpool(spool(1000, 1000, false));
        store.createUsage(new UsageRecord(UUID.randomUUID(), a.id(), 10, ACQUIRED, null, UsageCategory.PRINT));
        store.createUsage(new UsageRecord(UUID.randomUUID(), a.id(), 20, ACQUIRED.plusSeconds(60), "x", UsageCategory.FAILED_PRINT));
        UsageRecord kept = store.createUsage(new UsageRecord(UUID.randomUUID(), b.id(), 5, ACQUIRED, null, UsageCategory.PRINT));

        int removed = store.deleteUsage(store.usageIdsForSpool(a.id()));
        store.deleteSpool(a.id());

        assertThat(removed).isEqualTo(2);
        assertThat(store.findSpool(a.id())).isEmpty();
        assertThat(store.allUsage()).containsExactly(kept);
    }

    @Test
    void usageHistoryIsNewestFirstAndKeepsCategory() {
        Spool spool = store.createSpool(spool(1000, 1000, false));
        store.createUsage(new UsageRecord(UUID.randomUUID(), spool.id(), 10, ACQUIRED, null, UsageCategory.PRINT));
        store.createUsage(new UsageRecord(UUID.randomUUID(), spool.id(), 20, ACQUIRED.plusSeconds(60), null, UsageCategory.CALIBRATION));

        assertThat(store.usageForSpool(spool.id())).extracting(UsageRecord::category)
                .containsExactly(UsageCategory.CALIBRATION, UsageCategory.PRINT);
    }

    @Test
    void colorsAreKeyedCaseInsensitively() {
        store.saveColor(new MaterialColor("PETG", "#8BC5D9"));
        store.saveColor(new MaterialColor("petg", "#FF0000"));

        assertThat(store.allColors()).hasSize(1);
        assertThat(store.findColor("Petg")).contains(new MaterialColor("PETG", "#FF0000"));

        store.deleteAllColors();
        assertThat(store.allColors()).isEmpty();
    }

    @Test
    void settingsStayASingleRow() {
        store.saveSettings(new LedgerSettings(1.75, 20, "$", Language.SYSTEM));
        store.saveSettings(new LedgerSettings(2.85, 30, "€", Language.ENGLISH));

        assertThat(settingsRepository.count()).isEqualTo(1);
        assertThat(store.findSettings()).contains(new LedgerSettings(2.85, 30, "€", Language.ENGLISH));
    }

    @Test
    void remainingAboveInitialViolatesSchemaCheck() {
        Spool broken = spool(100, 150, false);

        assertThrows(DataIntegrityViolationException.class,
                () -> spoolRepository.saveAndFlush(SpoolEntity.from(broken)));
    }
}
