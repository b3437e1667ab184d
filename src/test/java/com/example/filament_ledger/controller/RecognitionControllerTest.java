package com.example.filament_ledger.controller;

import com.example.filament_ledger.service.recognition.SpoolSuggestion;
import com.example.filament_ledger.service.recognition.SuggestionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = RecognitionController.class)
class RecognitionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private SuggestionService suggestionService;

    @Test
    void returnsSuggestionForUploadedImage() throws Exception {
        when(suggestionService.suggest(any(), eq("label.jpg"), eq("image/jpeg")))
                .thenReturn(new SpoolSuggestion("Polymaker", "PLA", "Teal", "#008080", 1000.0, 1.75, null, 0.7));
        MockMultipartFile image = new MockMultipartFile("image", "label.jpg", "image/jpeg", new byte[]{1, 2, 3});

        mockMvc.perform(multipart("/v1/recognition").file(image))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.brand").value("Polymaker"))
                .andExpect(jsonPath("$.initialMassGrams").value(1000.0))
                .andExpect(jsonPath("$.colorHex").value("#008080"));
    }

    @Test
    void unavailableRecognitionStillAnswersOk() throws Exception {
        when(suggestionService.suggest(any(), any(), any())).thenReturn(SpoolSuggestion.none());
        MockMultipartFile image = new MockMultipartFile("image", "label.jpg", "image/jpeg", new byte[]{1});

        mockMvc.perform(multipart("/v1/recognition").file(image))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.brand").doesNotExist());
    }
}
