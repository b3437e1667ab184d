package com.example.filament_ledger.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.closeTo;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = ConversionController.class)
class ConversionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void lengthToMassUsesMaterialDensity() throws Exception {
        mockMvc.perform(get("/v1/conversions/length-to-mass").param("lengthMeters", "10").param("material", "PLA"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.massGrams").value(closeTo(29.83, 0.01)))
                .andExpect(jsonPath("$.density").value(1.24));
    }

    @Test
    void explicitDensityWins() throws Exception {
        mockMvc.perform(get("/v1/conversions/mass-to-length")
                        .param("massGrams", "1000").param("diameterMm", "1.75").param("density", "1.27"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.lengthMeters").value(closeTo(327.3, 0.5)))
                .andExpect(jsonPath("$.density").value(1.27));
    }

    @Test
    void nonPositiveInputIsBadRequest() throws Exception {
        mockMvc.perform(get("/v1/conversions/length-to-mass").param("lengthMeters", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_INPUT"));
    }
}
