package com.example.filament_ledger.controller;

import com.example.filament_ledger.dto.web.ConversionResponse;
import com.example.filament_ledger.ledger.UnitConversion;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Stateless length/mass calculator. Density comes from {@code density} when given, otherwise from
 * the material table.
 */
@RestController
@RequestMapping("/v1/conversions")
public class ConversionController {

    @GetMapping("/length-to-mass")
    public ConversionResponse lengthToMass(@RequestParam double lengthMeters,
                                           @RequestParam(defaultValue = "1.75") double diameterMm,
                                           @RequestParam(required = false) String material,
                                           @RequestParam(required = false) Double density) {
        double rho = density != null ? density : UnitConversion.densityForMaterial(material);
        double mass = UnitConversion.lengthToMass(lengthMeters, diameterMm, rho);
        return new ConversionResponse(lengthMeters, mass, diameterMm, rho);
    }

    @GetMapping("/mass-to-length")
    public ConversionResponse massToLength(@RequestParam double massGrams,
                                           @RequestParam(defaultValue = "1.75") double diameterMm,
                                           @RequestParam(required = false) String material,
                                           @RequestParam(required = false) Double density) {
        double rho = density != null ? density : UnitConversion.densityForMaterial(material);
        double length = UnitConversion.massToLength(massGrams, diameterMm, rho);
        return new ConversionResponse(length, massGrams, diameterMm, rho);
    }

    @GetMapping("/net-mass")
    public Map<String, Double> netMass(@RequestParam double grossMassGrams, @RequestParam double tareMassGrams) {
        return Map.of("netMassGrams", UnitConversion.netMass(grossMassGrams, tareMassGrams));
    }
}
