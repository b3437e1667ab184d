package com.example.filament_ledger.service;

import com.example.filament_ledger.ledger.IdGenerator;
import com.example.filament_ledger.ledger.LedgerError;
import com.example.filament_ledger.ledger.LedgerException;
import com.example.filament_ledger.ledger.Spool;
import com.example.filament_ledger.ledger.SpoolLedger;
import com.example.filament_ledger.ledger.UnitConversion;
import com.example.filament_ledger.ledger.UsageCategory;
import com.example.filament_ledger.ledger.UsageRecord;
import com.example.filament_ledger.store.InventoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Write path for logged consumption. One call may draw from several spools; each entry is validated
 * and committed on its own, so a bad entry never blocks the others.
 */
@Service
public class UsageRecorder {
    private static final Logger LOGGER = LoggerFactory.getLogger(UsageRecorder.class);

    private final InventoryStore store;
    private final SpoolLedger ledger;
    private final IdGenerator idGenerator;
    private final Clock clock;

    public UsageRecorder(InventoryStore store, SpoolLedger ledger, IdGenerator idGenerator, Clock clock) {
        this.store = store;
        this.ledger = ledger;
        this.idGenerator = idGenerator;
        this.clock = clock;
    }

    /**
     * Records the entries in order.
     *
     * @param entries requested consumption, possibly several per spool
     * @return one outcome per entry, in input order
     */
    public UsageReport recordUsage(List<UsageEntry> entries) {
        List<EntryOutcome> outcomes = new ArrayList<>(entries.size());
        for (UsageEntry entry : entries) {
            outcomes.add(recordOne(entry));
        }
        UsageReport report = new UsageReport(outcomes);
        LOGGER.info("UsageRecorder recordUsage entries={} recorded={} rejected={}",
                entries.size(), report.recordedCount(), entries.size() - report.recordedCount());
        return report;
    }

    /**
     * Logs usage from a gross weigh-in: consumption is the drop from the current remaining mass to the
     * net reading.
     */
    public UsageReport recordWeighIn(UUID spoolId, double grossMassGrams, String label, UsageCategory category) {
        Spool spool = store.findSpool(spoolId).orElseThrow(() -> LedgerException.unknownSpool(spoolId));
        if (spool.tareMassGrams() == null) {
            throw LedgerException.invalidInput("Spool " + spoolId + " has no tare mass; weigh-in needs the empty reel weight");
        }
        if (grossMassGrams < 0) {
            throw LedgerException.invalidInput("Gross mass cannot be negative, got " + grossMassGrams);
        }
        double used = UnitConversion.usedSinceWeighIn(spool.remainingMassGrams(), grossMassGrams, spool.tareMassGrams());
        if (used <= 0) {
            throw LedgerException.invalidAmount("Weigh-in of " + grossMassGrams + " g shows no consumption for spool " + spoolId);
        }
        return recordUsage(List.of(new UsageEntry(spoolId, used, label, category, null)));
    }

    private EntryOutcome recordOne(UsageEntry entry) {
        if (entry.spoolId() == null) {
            return EntryOutcome.rejected(entry, LedgerError.UNKNOWN_SPOOL, "Spool id is required");
        }
        if (!(entry.massGrams() > 0)) {
            return EntryOutcome.rejected(entry, LedgerError.INVALID_AMOUNT,
                    "Consumed mass must be greater than zero, got " + entry.massGrams());
        }
        Optional<Spool> found = store.findSpool(entry.spoolId());
        if (found.isEmpty()) {
            return EntryOutcome.rejected(entry, LedgerError.UNKNOWN_SPOOL, "No spool with id " + entry.spoolId());
        }
        Spool spool = found.get();
        if (spool.remainingMassGrams() <= 0) {
            return EntryOutcome.rejected(entry, LedgerError.INVALID_AMOUNT,
                    "Spool " + spool.id() + " has no filament left");
        }

        double mass = entry.massGrams();
        UsageNotice notice = null;
        if (mass > spool.remainingMassGrams()) {
            mass = spool.remainingMassGrams();
            notice = UsageNotice.clamped(spool.id(), entry.massGrams(), mass);
        }

        Instant recordedAt = entry.recordedAt() != null ? entry.recordedAt() : clock.instant();
        UsageCategory category = entry.category() != null ? entry.category() : UsageCategory.PRINT;
        UsageRecord record = new UsageRecord(idGenerator.next(), spool.id(), mass, recordedAt, entry.label(), category);
        Spool updated = ledger.applyConsumption(spool, mass);

        try {
            store.createUsage(record);
        } catch (DataAccessException ex) {
            LOGGER.error("UsageRecorder write failed spoolId={} recordId={}", spool.id(), record.id(), ex);
            return EntryOutcome.rejected(entry, LedgerError.WRITE_FAILED, "Could not store usage: " + ex.getMostSpecificCause().getMessage());
        }
        try {
            store.updateSpool(updated);
        } catch (DataAccessException ex) {
            LOGGER.error("UsageRecorder spool update failed spoolId={} recordId={}", spool.id(), record.id(), ex);
            return EntryOutcome.rejected(entry, LedgerError.WRITE_FAILED, withdraw(record, ex));
        }
        LOGGER.info("UsageRecorder record spoolId={} mass={} remaining={} archived={} clamped={}",
                spool.id(), mass, updated.remainingMassGrams(), updated.archived(), notice != null);
        return EntryOutcome.recorded(entry, record, updated, notice);
    }

    /**
     * Removes a record whose spool update did not commit, so the record log and the spool's consumed
     * mass stay equal and a retry does not count the usage twice.
     */
    private String withdraw(UsageRecord record, DataAccessException cause) {
        String reason = "Could not update spool " + record.spoolId() + ": " + cause.getMostSpecificCause().getMessage();
        try {
            store.deleteUsage(List.of(record.id()));
            LOGGER.info("UsageRecorder withdrew recordId={} spoolId={}", record.id(), record.spoolId());
            return reason + "; usage was not recorded";
        } catch (DataAccessException undo) {
            LOGGER.error("UsageRecorder could not withdraw recordId={} spoolId={}", record.id(), record.spoolId(), undo);
            return reason + "; usage record " + record.id() + " is stored without a matching spool update";
        }
    }

    /**
     * One requested consumption.
     *
     * @param recordedAt backdated timestamp, {@code null} for now
     */
    public record UsageEntry(UUID spoolId, double massGrams, String label, UsageCategory category, Instant recordedAt) {
    }

    /**
     * Non-fatal information attached to an otherwise successful entry.
     */
    public record UsageNotice(NoticeType type, UUID spoolId, double requestedGrams, double recordedGrams, String message) {
        static UsageNotice clamped(UUID spoolId, double requested, double recorded) {
            return new UsageNotice(NoticeType.CLAMPED_TO_AVAILABLE, spoolId, requested, recorded,
                    "Requested " + requested + " g but only " + recorded + " g was left; recorded " + recorded + " g");
        }
    }

    public enum NoticeType {
        CLAMPED_TO_AVAILABLE
    }

    /**
     * Result of one entry: either a stored record with the spool's new state, or a rejection reason.
     */
    public record EntryOutcome(UsageEntry entry,
                               UsageRecord record,
                               Spool spool,
                               UsageNotice notice,
                               LedgerError error,
                               String reason) {
        static EntryOutcome recorded(UsageEntry entry, UsageRecord record, Spool spool, UsageNotice notice) {
            return new EntryOutcome(entry, record, spool, notice, null, null);
        }

        static EntryOutcome rejected(UsageEntry entry, LedgerError error, String reason) {
            return new EntryOutcome(entry, null, null, null, error, reason);
        }

        public boolean isRecorded() {
            return record != null;
        }
    }

    public record UsageReport(List<EntryOutcome> outcomes) {
        public List<UsageRecord> records() {
            return outcomes.stream().filter(EntryOutcome::isRecorded).map(EntryOutcome::record).toList();
        }

        public List<UsageNotice> notices() {
            return outcomes.stream().map(EntryOutcome::notice).filter(n -> n != null).toList();
        }

        public int recordedCount() {
            return (int) outcomes.stream().filter(EntryOutcome::isRecorded).count();
        }
    }
}
