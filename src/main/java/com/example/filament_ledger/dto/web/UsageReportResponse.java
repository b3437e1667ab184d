package com.example.filament_ledger.dto.web;

import com.example.filament_ledger.ledger.LedgerError;
import com.example.filament_ledger.service.UsageRecorder.EntryOutcome;
import com.example.filament_ledger.service.UsageRecorder.UsageNotice;
import com.example.filament_ledger.service.UsageRecorder.UsageReport;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

public record UsageReportResponse(int recorded, int rejected, List<Outcome> outcomes) {

    public static UsageReportResponse from(UsageReport report) {
        List<Outcome> outcomes = new ArrayList<>();
        for (int i = 0; i < report.outcomes().size(); i++) {
            outcomes.add(Outcome.from(i, report.outcomes().get(i)));
        }
        int recorded = report.recordedCount();
        return new UsageReportResponse(recorded, outcomes.size() - recorded, outcomes);
    }

    public record Outcome(
            int index,
            UUID spoolId,
            boolean recorded,
            UsageRecordResponse record,
            Double remainingMassGrams,
            Boolean archived,
            UsageNotice notice,
            LedgerError error,
            String reason
    ) {
        static Outcome from(int index, EntryOutcome o) {
            if (o.isRecorded()) {
                return new Outcome(index, o.record().spoolId(), true, UsageRecordResponse.from(o.record()),
                        o.spool().remainingMassGrams(), o.spool().archived(), o.notice(), null, null);
            }
            return new Outcome(index, o.entry().spoolId(), false, null, null, null, null, o.error(), o.reason());
        }
    }
}
