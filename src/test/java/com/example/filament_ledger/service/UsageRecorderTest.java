package com.example.filament_ledger.service;

import com.example.filament_ledger.ledger.IdGenerator;
import com.example.filament_ledger.ledger.Language;
import com.example.filament_ledger.ledger.LedgerError;
import com.example.filament_ledger.ledger.LedgerException;
import com.example.filament_ledger.ledger.LedgerSettings;
import com.example.filament_ledger.ledger.Spool;
import com.example.filament_ledger.ledger.SpoolDraft;
import com.example.filament_ledger.ledger.SpoolLedger;
import com.example.filament_ledger.ledger.UsageCategory;
import com.example.filament_ledger.service.UsageRecorder.EntryOutcome;
import com.example.filament_ledger.service.UsageRecorder.NoticeType;
import com.example.filament_ledger.service.UsageRecorder.UsageEntry;
import com.example.filament_ledger.service.UsageRecorder.UsageReport;
import com.example.filament_ledger.store.InMemoryInventoryStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class UsageRecorderTest {
    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");
    private static final LedgerSettings SETTINGS = new LedgerSettings(1.75, 20, "$", Language.SYSTEM);

    private InMemoryInventoryStore store;
    private SpoolLedger ledger;
    private UsageRecorder recorder;

    @BeforeEach
    void setup() {
        AtomicLong counter = new AtomicLong();
        IdGenerator ids = () -> new UUID(0, counter.incrementAndGet());
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        store = new InMemoryInventoryStore();
        ledger = new SpoolLedger(clock, ids);
        recorder = new UsageRecorder(store, ledger, ids, clock);
    }

    private Spool stock(double initial, Double tare) {
        SpoolDraft draft = new SpoolDraft("Brand", "PLA", "Red", null, null, initial, tare, null,
                null, null, null, null, null, null);
        return store.createSpool(ledger.create(draft, SETTINGS));
    }

    @Test
    void recordingReducesRemainingAndStoresRecord() {
        Spool spool = stock(1000, null);

        UsageReport report = recorder.recordUsage(List.of(new UsageEntry(spool.id(), 120, "Benchy", UsageCategory.PRINT, null)));

        assertThat(report.recordedCount()).isEqualTo(1);
        assertThat(store.findSpool(spool.id()).orElseThrow().remainingMassGrams()).isEqualTo(880);
        assertThat(store.usageForSpool(spool.id())).singleElement()
                .satisfies(r -> {
                    assertThat(r.massGrams()).isEqualTo(120);
                    assertThat(r.recordedAt()).isEqualTo(NOW);
                    assertThat(r.label()).isEqualTo("Benchy");
                });
    }

    @Test
    void overdrawIsClampedWithNoticeAndArchives() {
        Spool spool = stock(30, null);

        UsageReport report = recorder.recordUsage(List.of(new UsageEntry(spool.id(), 50, "Benchy", null, null)));

        EntryOutcome outcome = report.outcomes().get(0);
        assertThat(outcome.isRecorded()).isTrue();
        assertThat(outcome.record().massGrams()).isEqualTo(30);
        assertThat(outcome.notice().type()).isEqualTo(NoticeType.CLAMPED_TO_AVAILABLE);
        assertThat(outcome.notice().requestedGrams()).isEqualTo(50);
        Spool after = store.findSpool(spool.id()).orElseThrow();
        assertThat(after.remainingMassGrams()).isZero();
        assertThat(after.archived()).isTrue();
    }

    @Test
    void badEntriesAreRejectedIndividually() {
        Spool spool = stock(500, null);
        UUID missing = UUID.randomUUID();

        UsageReport report = recorder.recordUsage(List.of(
                new UsageEntry(missing, 10, null, null, null),
                new UsageEntry(spool.id(), -5, null, null, null),
                new UsageEntry(spool.id(), 25, null, null, null)));

        assertThat(report.outcomes()).extracting(EntryOutcome::error)
                .containsExactly(LedgerError.UNKNOWN_SPOOL, LedgerError.INVALID_AMOUNT, null);
        assertThat(report.recordedCount()).isEqualTo(1);
        assertThat(store.findSpool(spool.id()).orElseThrow().remainingMassGrams()).isEqualTo(475);
        assertThat(store.allUsage()).hasSize(1);
    }

    @Test
    void emptySpoolRejectsFurtherUsage() {
        Spool spool = stock(10, null);
        recorder.recordUsage(List.of(new UsageEntry(spool.id(), 10, null, null, null)));

        UsageReport report = recorder.recordUsage(List.of(new UsageEntry(spool.id(), 1, null, null, null)));

        assertThat(report.outcomes().get(0).error()).isEqualTo(LedgerError.INVALID_AMOUNT);
        assertThat(store.allUsage()).hasSize(1);
    }

    @Test
    void multipleEntriesOnSameSpoolApplyInOrder() {
        Spool spool = stock(100, null);

        UsageReport report = recorder.recordUsage(List.of(
                new UsageEntry(spool.id(), 60, null, null, null),
                new UsageEntry(spool.id(), 60, null, null, null)));

        assertThat(report.records()).extracting(r -> r.massGrams()).containsExactly(60.0, 40.0);
        assertThat(report.notices()).hasSize(1);
        assertThat(store.findSpool(spool.id()).orElseThrow().archived()).isTrue();
    }

    @Test
    void writeFailureIsReportedForThatEntryOnly() {
        Spool first = stock(100, null);
        Spool second = stock(100, null);
        store.failAfterWrites(2);

        UsageReport report = recorder.recordUsage(List.of(
                new UsageEntry(first.id(), 10, null, null, null),
                new UsageEntry(second.id(), 10, null, null, null)));

        assertThat(report.outcomes().get(0).isRecorded()).isTrue();
        assertThat(report.outcomes().get(1).error()).isEqualTo(LedgerError.WRITE_FAILED);
    }

    @Test
    void failedSpoolUpdateWithdrawsTheRecord() {
        Spool spool = stock(1000, null);
        store.failAfterWrites(1);

        UsageReport report = recorder.recordUsage(List.of(new UsageEntry(spool.id(), 120, "Benchy", null, null)));

        EntryOutcome outcome = report.outcomes().get(0);
        assertThat(outcome.isRecorded()).isFalse();
        assertThat(outcome.error()).isEqualTo(LedgerError.WRITE_FAILED);
        assertThat(store.usageForSpool(spool.id())).isEmpty();
        assertThat(store.findSpool(spool.id()).orElseThrow().remainingMassGrams()).isEqualTo(1000);

        UsageReport retry = recorder.recordUsage(List.of(new UsageEntry(spool.id(), 120, "Benchy", null, null)));

        assertThat(retry.recordedCount()).isEqualTo(1);
        assertThat(store.usageForSpool(spool.id())).hasSize(1);
        assertThat(store.findSpool(spool.id()).orElseThrow().remainingMassGrams()).isEqualTo(880);
    }

    @Test
    void nearlyEmptySpoolClampsBenchyPrint() {
        Spool spool = store.updateSpool(ledger.correctRemaining(stock(1000, null), 50));

        UsageReport report = recorder.recordUsage(List.of(new UsageEntry(spool.id(), 200, "Benchy", UsageCategory.PRINT, null)));

        EntryOutcome outcome = report.outcomes().get(0);
        assertThat(outcome.record().massGrams()).isEqualTo(50);
        assertThat(outcome.notice().type()).isEqualTo(NoticeType.CLAMPED_TO_AVAILABLE);
        Spool stored = store.findSpool(spool.id()).orElseThrow();
        assertThat(stored.remainingMassGrams()).isZero();
        assertThat(stored.archived()).isTrue();
    }

    @Test
    void recordedMassAlwaysMatchesConsumedMass() {
        Spool spool = stock(750, null);
        double[] amounts = {12.5, 80, 0.3, 150, 99.9, 200, 7, 300, 45};

        for (double amount : amounts) {
            recorder.recordUsage(List.of(new UsageEntry(spool.id(), amount, null, null, null)));

            Spool current = store.findSpool(spool.id()).orElseThrow();
            double logged = store.usageForSpool(spool.id()).stream().mapToDouble(r -> r.massGrams()).sum();
            assertThat(current.remainingMassGrams()).isBetween(0.0, current.initialMassGrams());
            assertThat(logged).isCloseTo(current.consumedMassGrams(), within(1e-9));
        }
        assertThat(store.findSpool(spool.id()).orElseThrow().archived()).isTrue();
    }

    @Test
    void sameInputsProduceSameRecords() {
        Spool spool = stock(100, null);
        UsageReport report = recorder.recordUsage(List.of(new UsageEntry(spool.id(), 5, "x", null, null)));

        setup();
        Spool again = stock(100, null);
        UsageReport replay = recorder.recordUsage(List.of(new UsageEntry(again.id(), 5, "x", null, null)));

        assertThat(replay.records()).isEqualTo(report.records());
    }

    @Test
    void weighInDerivesConsumptionFromTare() {
        Spool spool = stock(1000, 250.0);

        UsageReport report = recorder.recordWeighIn(spool.id(), 1050, "weigh-in", UsageCategory.MANUAL_ADJUSTMENT);

        assertThat(report.records()).singleElement().satisfies(r -> {
            assertThat(r.massGrams()).isEqualTo(200);
            assertThat(r.category()).isEqualTo(UsageCategory.MANUAL_ADJUSTMENT);
        });
        assertThat(store.findSpool(spool.id()).orElseThrow().remainingMassGrams()).isEqualTo(800);
    }

    @Test
    void weighInWithoutTareOrConsumptionIsRejected() {
        Spool noTare = stock(1000, null);
        Spool withTare = stock(1000, 250.0);

        assertThatThrownBy(() -> recorder.recordWeighIn(noTare.id(), 900, null, null))
                .isInstanceOf(LedgerException.class)
                .hasMessageContaining("tare");
        assertThatThrownBy(() -> recorder.recordWeighIn(withTare.id(), 1300, null, null))
                .isInstanceOf(LedgerException.class)
                .extracting(ex -> ((LedgerException) ex).getError())
                .isEqualTo(LedgerError.INVALID_AMOUNT);
    }
}
