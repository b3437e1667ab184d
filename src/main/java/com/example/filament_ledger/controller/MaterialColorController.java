package com.example.filament_ledger.controller;

import com.example.filament_ledger.dto.web.MaterialColorRequest;
import com.example.filament_ledger.dto.web.MaterialColorResponse;
import com.example.filament_ledger.service.MaterialColorRegistry;
import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/v1/material-colors")
public class MaterialColorController {
    private final MaterialColorRegistry registry;

    public MaterialColorController(MaterialColorRegistry registry) {
        this.registry = registry;
    }

    @GetMapping
    public List<MaterialColorResponse> list() {
        return registry.list().stream().map(MaterialColorResponse::from).toList();
    }

    @Operation(summary = "Chart color for a material, allocated on first use")
    @PostMapping("/resolve")
    public MaterialColorResponse resolve(@RequestParam String material) {
        return new MaterialColorResponse(material.trim(), registry.colorFor(material));
    }

    @Operation(summary = "Override the chart color of a material")
    @PutMapping("/{material}")
    public MaterialColorResponse override(@PathVariable String material, @Valid @RequestBody MaterialColorRequest request) {
        return MaterialColorResponse.from(registry.override(material, request.colorHex()));
    }
}
