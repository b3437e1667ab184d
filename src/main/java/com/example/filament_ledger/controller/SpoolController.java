package com.example.filament_ledger.controller;

import com.example.filament_ledger.dto.web.RemainingCorrectionRequest;
import com.example.filament_ledger.dto.web.SpoolCreateRequest;
import com.example.filament_ledger.dto.web.SpoolResponse;
import com.example.filament_ledger.dto.web.SpoolUpdateRequest;
import com.example.filament_ledger.dto.web.UsageRecordResponse;
import com.example.filament_ledger.ledger.LedgerException;
import com.example.filament_ledger.ledger.Spool;
import com.example.filament_ledger.service.SpoolService;
import com.example.filament_ledger.service.SpoolService.SpoolFilter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

@RestController
@RequestMapping("/v1/spools")
public class SpoolController {
    private final SpoolService spoolService;
    private final Clock clock;

    public SpoolController(SpoolService spoolService, Clock clock) {
        this.spoolService = spoolService;
        this.clock = clock;
    }

    @Operation(summary = "Stock a new spool")
    @ApiResponse(responseCode = "201", description = "Spool created, full and active")
    @ApiResponse(responseCode = "400", description = "Invalid mass, diameter or color")
    @PostMapping
    public ResponseEntity<SpoolResponse> create(@Valid @RequestBody SpoolCreateRequest request) {
        Spool spool = spoolService.create(request.toDraft());
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(spool));
    }

    @GetMapping
    public List<SpoolResponse> list(@RequestParam(defaultValue = "active") String filter,
                                    @RequestParam(required = false) String material) {
        double threshold = threshold();
        return spoolService.list(parseFilter(filter), material).stream()
                .map(s -> SpoolResponse.from(s, threshold, clock))
                .toList();
    }

    @Operation(summary = "Active spools below the low-stock threshold, emptiest first")
    @GetMapping("/low-stock")
    public List<SpoolResponse> lowStock() {
        double threshold = threshold();
        return spoolService.lowStock().stream().map(s -> SpoolResponse.from(s, threshold, clock)).toList();
    }

    @GetMapping("/{id}")
    public SpoolResponse get(@PathVariable UUID id) {
        return toResponse(spoolService.get(id));
    }

    @Operation(summary = "Edit spool attributes; a new initial mass keeps the consumption so far")
    @PatchMapping("/{id}")
    public SpoolResponse update(@PathVariable UUID id, @Valid @RequestBody SpoolUpdateRequest request) {
        return toResponse(spoolService.edit(id, request.toDetails(), request.initialMassGrams()));
    }

    @Operation(summary = "Correct the remaining mass by hand; zero archives the spool")
    @PutMapping("/{id}/remaining")
    public SpoolResponse correctRemaining(@PathVariable UUID id, @Valid @RequestBody RemainingCorrectionRequest request) {
        return toResponse(spoolService.correctRemaining(id, request.remainingMassGrams()));
    }

    @PostMapping("/{id}/archive")
    public SpoolResponse archive(@PathVariable UUID id) {
        return toResponse(spoolService.archive(id));
    }

    @PostMapping("/{id}/restore")
    public SpoolResponse restore(@PathVariable UUID id) {
        return toResponse(spoolService.restore(id));
    }

    @Operation(summary = "Delete a spool together with its usage history")
    @ApiResponse(responseCode = "204", description = "Spool and usage records deleted")
    @ApiResponse(responseCode = "404", description = "Unknown spool")
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        spoolService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/usage")
    public List<UsageRecordResponse> usage(@PathVariable UUID id) {
        return spoolService.usageHistory(id).stream().map(UsageRecordResponse::from).toList();
    }

    private SpoolResponse toResponse(Spool spool) {
        return SpoolResponse.from(spool, threshold(), clock);
    }

    private double threshold() {
        return spoolService.settings().lowStockThreshold();
    }

    private static SpoolFilter parseFilter(String filter) {
        try {
            return SpoolFilter.valueOf(filter.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw LedgerException.invalidInput("Unknown filter '" + filter + "', expected active, archived or all");
        }
    }
}
