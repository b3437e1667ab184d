package com.example.filament_ledger.controller;

import com.example.filament_ledger.ledger.LedgerError;
import com.example.filament_ledger.ledger.LedgerException;
import com.example.filament_ledger.service.transfer.ImportPolicy;
import com.example.filament_ledger.service.transfer.ImportResult;
import com.example.filament_ledger.service.transfer.InventoryReconciler;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

@RestController
@RequestMapping("/v1/transfer")
public class TransferController {
    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd_HHmmss");

    private final InventoryReconciler reconciler;
    private final Clock clock;

    public TransferController(InventoryReconciler reconciler, Clock clock) {
        this.reconciler = reconciler;
        this.clock = clock;
    }

    @Operation(summary = "Download the whole inventory as a JSON export file")
    @GetMapping(value = "/export", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> export() {
        String filename = "FilamentTracker_Export_" + LocalDateTime.now(clock).format(FILE_STAMP) + ".json";
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(filename).build().toString())
                .contentType(MediaType.APPLICATION_JSON)
                .body(reconciler.exportJson());
    }

    @Operation(summary = "Import an export document, merging into or replacing the inventory")
    @ApiResponse(responseCode = "200", description = "Import committed")
    @ApiResponse(responseCode = "422", description = "Document rejected, nothing written")
    @ApiResponse(responseCode = "500", description = "Write failed part-way, counts in the body")
    @PostMapping(value = "/import", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ImportResult importJson(@RequestParam(defaultValue = "merge") String policy, @RequestBody String document) {
        return reconciler.importJson(document, ImportPolicy.fromValue(policy));
    }

    @PostMapping(value = "/import", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ImportResult importFile(@RequestParam(defaultValue = "merge") String policy,
                                   @RequestPart("file") MultipartFile file) {
        String document;
        try {
            document = new String(file.getBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new LedgerException(LedgerError.INVALID_INPUT,
                    "Could not read uploaded file", ex);
        }
        return reconciler.importJson(document, ImportPolicy.fromValue(policy));
    }
}
