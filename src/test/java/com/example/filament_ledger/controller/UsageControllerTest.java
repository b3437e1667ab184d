package com.example.filament_ledger.controller;

import com.example.filament_ledger.ledger.LedgerError;
import com.example.filament_ledger.ledger.Spool;
import com.example.filament_ledger.ledger.UsageCategory;
import com.example.filament_ledger.ledger.UsageRecord;
import com.example.filament_ledger.service.UsageRecorder;
import com.example.filament_ledger.service.UsageRecorder.EntryOutcome;
import com.example.filament_ledger.service.UsageRecorder.NoticeType;
import com.example.filament_ledger.service.UsageRecorder.UsageEntry;
import com.example.filament_ledger.service.UsageRecorder.UsageNotice;
import com.example.filament_ledger.service.UsageRecorder.UsageReport;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = UsageController.class)
class UsageControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private UsageRecorder usageRecorder;

    @Test
    @SuppressWarnings("unchecked")
    void reportsPerEntryOutcomes() throws Exception {
        UUID spoolId = UUID.randomUUID();
        UUID missing = UUID.randomUUID();
        Instant at = Instant.parse("2024-06-01T12:00:00Z");
        UsageEntry okEntry = new UsageEntry(spoolId, 50, "Benchy", UsageCategory.PRINT, null);
        UsageEntry badEntry = new UsageEntry(missing, 5, null, null, null);
        UsageRecord record = new UsageRecord(UUID.randomUUID(), spoolId, 30, at, "Benchy", UsageCategory.PRINT);
        Spool spool = new Spool(spoolId, "", "PLA", "", "#CCCCCC", 1.75, 1000, 0, null, null,
                null, null, null, null, at, true, null);
        UsageNotice notice = new UsageNotice(NoticeType.CLAMPED_TO_AVAILABLE, spoolId, 50, 30, "clamped");
        when(usageRecorder.recordUsage(anyList())).thenReturn(new UsageReport(List.of(
                new EntryOutcome(okEntry, record, spool, notice, null, null),
                new EntryOutcome(badEntry, null, null, null, LedgerError.UNKNOWN_SPOOL, "No spool with id " + missing))));

        String body = """
                {"entries":[
                  {"spoolId":"%s","massGrams":50,"label":"Benchy","category":"print"},
                  {"spoolId":"%s","massGrams":5}
                ]}
                """.formatted(spoolId, missing);

        mockMvc.perform(post("/v1/usage").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.recorded").value(1))
                .andExpect(jsonPath("$.rejected").value(1))
                .andExpect(jsonPath("$.outcomes[0].record.massGrams").value(30.0))
                .andExpect(jsonPath("$.outcomes[0].archived").value(true))
                .andExpect(jsonPath("$.outcomes[0].notice.type").value("CLAMPED_TO_AVAILABLE"))
                .andExpect(jsonPath("$.outcomes[1].error").value("UNKNOWN_SPOOL"));

        ArgumentCaptor<List<UsageEntry>> captor = ArgumentCaptor.forClass(List.class);
        verify(usageRecorder).recordUsage(captor.capture());
        assertThat(captor.getValue()).containsExactly(okEntry, badEntry);
    }

    @Test
    void emptyBatchIsBadRequest() throws Exception {
        mockMvc.perform(post("/v1/usage").contentType(MediaType.APPLICATION_JSON).content("{\"entries\":[]}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void weighInRequiresSpoolAndReading() throws Exception {
        mockMvc.perform(post("/v1/usage/weigh-in").contentType(MediaType.APPLICATION_JSON).content("{\"label\":\"x\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.violations.length()").value(2));
    }
}
