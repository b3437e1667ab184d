package com.example.filament_ledger.controller;

import com.example.filament_ledger.ledger.Language;
import com.example.filament_ledger.ledger.LedgerException;
import com.example.filament_ledger.ledger.LedgerSettings;
import com.example.filament_ledger.service.SettingsService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = SettingsController.class)
class SettingsControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private SettingsService settingsService;

    @Test
    void getReturnsLanguageCode() throws Exception {
        when(settingsService.current()).thenReturn(new LedgerSettings(1.75, 20, "$", Language.CHINESE));

        mockMvc.perform(get("/v1/settings"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.language").value("zh_Hans"))
                .andExpect(jsonPath("$.lowStockThreshold").value(20.0));
    }

    @Test
    void updatePassesParsedSettings() throws Exception {
        LedgerSettings expected = new LedgerSettings(2.85, 30, "€", Language.ENGLISH);
        when(settingsService.update(expected)).thenReturn(expected);

        mockMvc.perform(put("/v1/settings").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"defaultDiameterMm\":2.85,\"lowStockThreshold\":30,\"currency\":\"€\",\"language\":\"en\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.defaultDiameterMm").value(2.85));

        verify(settingsService).update(expected);
    }

    @Test
    void thresholdAboveHundredIsBadRequest() throws Exception {
        mockMvc.perform(put("/v1/settings").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"defaultDiameterMm\":1.75,\"lowStockThreshold\":101,\"currency\":\"$\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void nonStandardDiameterIsBadRequest() throws Exception {
        when(settingsService.update(any())).thenThrow(LedgerException.invalidInput("Default diameter 2.0 mm is not standard"));

        mockMvc.perform(put("/v1/settings").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"defaultDiameterMm\":2.0,\"lowStockThreshold\":20,\"currency\":\"$\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_INPUT"));
    }
}
