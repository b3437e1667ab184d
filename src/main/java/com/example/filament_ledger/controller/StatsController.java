package com.example.filament_ledger.controller;

import com.example.filament_ledger.ledger.LedgerException;
import com.example.filament_ledger.service.InventoryStatsService;
import com.example.filament_ledger.service.InventoryStatsService.UsageSummary;
import io.swagger.v3.oas.annotations.Operation;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

@RestController
@RequestMapping("/v1/stats")
public class StatsController {
    private final InventoryStatsService statsService;

    public StatsController(InventoryStatsService statsService) {
        this.statsService = statsService;
    }

    @Operation(summary = "Usage totals, cost and per-material breakdown for a time window")
    @GetMapping("/usage")
    public UsageSummary usage(@RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
                              @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        if (from != null && to != null && !from.isBefore(to)) {
            throw LedgerException.invalidInput("'from' must be before 'to'");
        }
        return statsService.summarize(from, to);
    }
}
