package com.example.filament_ledger.controller;

import com.example.filament_ledger.ledger.LedgerError;
import com.example.filament_ledger.ledger.LedgerException;
import com.example.filament_ledger.service.recognition.SpoolSuggestion;
import com.example.filament_ledger.service.recognition.SuggestionService;
import io.swagger.v3.oas.annotations.Operation;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

@RestController
@RequestMapping("/v1/recognition")
public class RecognitionController {
    private final SuggestionService suggestionService;

    public RecognitionController(SuggestionService suggestionService) {
        this.suggestionService = suggestionService;
    }

    @Operation(summary = "Suggest spool attributes from a label photo; empty when recognition is unavailable")
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public SpoolSuggestion recognize(@RequestPart("image") MultipartFile image) {
        try {
            return suggestionService.suggest(image.getBytes(), image.getOriginalFilename(), image.getContentType());
        } catch (IOException ex) {
            throw new LedgerException(LedgerError.INVALID_INPUT, "Could not read uploaded image", ex);
        }
    }
}
