package com.example.filament_ledger.controller;

import com.example.filament_ledger.dto.web.UsageBatchRequest;
import com.example.filament_ledger.dto.web.UsageReportResponse;
import com.example.filament_ledger.dto.web.WeighInRequest;
import com.example.filament_ledger.service.UsageRecorder;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/usage")
public class UsageController {
    private final UsageRecorder usageRecorder;

    public UsageController(UsageRecorder usageRecorder) {
        this.usageRecorder = usageRecorder;
    }

    @Operation(summary = "Record consumption against one or more spools")
    @ApiResponse(responseCode = "200", description = "Per-entry outcome; rejected entries carry an error code")
    @PostMapping
    public UsageReportResponse record(@Valid @RequestBody UsageBatchRequest request) {
        return UsageReportResponse.from(usageRecorder.recordUsage(request.toEntries()));
    }

    @Operation(summary = "Record consumption from a gross weigh-in of the spool")
    @PostMapping("/weigh-in")
    public UsageReportResponse weighIn(@Valid @RequestBody WeighInRequest request) {
        return UsageReportResponse.from(usageRecorder.recordWeighIn(
                request.spoolId(), request.grossMassGrams(), request.label(), request.category()));
    }
}
