package com.example.filament_ledger.service.transfer;

import com.example.filament_ledger.ledger.LedgerError;
import com.example.filament_ledger.ledger.LedgerException;

/**
 * A write failed part-way through an import. Entities written before the failure stay written.
 */
public class ImportFailedException extends LedgerException {
    private final ImportPolicy policy;
    private final int written;
    private final int total;

    public ImportFailedException(ImportPolicy policy, int written, int total, Throwable cause) {
        super(LedgerError.WRITE_FAILED, describe(policy, written, total), cause);
        this.policy = policy;
        this.written = written;
        this.total = total;
    }

    public ImportPolicy getPolicy() {
        return policy;
    }

    public int getWritten() {
        return written;
    }

    public int getTotal() {
        return total;
    }

    private static String describe(ImportPolicy policy, int written, int total) {
        String advice = policy == ImportPolicy.MERGE
                ? "Retrying the merge import is safe."
                : "Existing data may be mixed with imported data; run the replace import again from a clean state.";
        return "Partial import completed, " + written + " of " + total + " entities written. " + advice;
    }
}
