package com.example.filament_ledger.service;

import com.example.filament_ledger.ledger.HexColor;
import com.example.filament_ledger.ledger.LedgerException;
import com.example.filament_ledger.ledger.MaterialColor;
import com.example.filament_ledger.store.InventoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Stable material→chart color mapping.
 *
 * <p>Note that {@link #colorFor(String)} writes: the first lookup of an unseen material allocates and
 * stores its color. Once stored, a color only changes through {@link #override(String, String)}.
 */
@Service
public class MaterialColorRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(MaterialColorRegistry.class);

    public static final List<String> DEFAULT_PALETTE = List.of(
            "#7FD4B0", // green
            "#B88A5A", // brown
            "#8BC5D9", // blue
            "#8A7BC4", // purple
            "#F6C85F", // yellow
            "#FF6F61", // coral
            "#6B9B7A", // dark green
            "#C4A574", // tan
            "#F28E2B", // orange
            "#A0CBE8"  // light blue
    );

    public static final List<String> DEFAULT_MATERIALS = List.of(
            "PLA", "PLA+", "ABS", "PETG", "TPU", "ASA", "PA", "PC", "PVA", "HIPS", "Wood", "Carbon", "Silk", "Matte"
    );

    private final InventoryStore store;
    private final Random random;

    @Autowired
    public MaterialColorRegistry(InventoryStore store) {
        this(store, new Random());
    }

    MaterialColorRegistry(InventoryStore store, Random random) {
        this.store = store;
        this.random = random;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void seedOnStartup() {
        ensureSeeded();
    }

    /**
     * Seeds the default materials with the palette assigned cyclically, only when the registry is
     * completely empty.
     *
     * @return number of entries written, 0 when the registry already had content
     */
    public int ensureSeeded() {
        if (!store.allColors().isEmpty()) {
            return 0;
        }
        for (int i = 0; i < DEFAULT_MATERIALS.size(); i++) {
            String color = DEFAULT_PALETTE.get(i % DEFAULT_PALETTE.size());
            store.saveColor(new MaterialColor(DEFAULT_MATERIALS.get(i), color));
        }
        LOGGER.info("MaterialColorRegistry seeded materials={}", DEFAULT_MATERIALS.size());
        return DEFAULT_MATERIALS.size();
    }

    /**
     * Color for a material, allocating and persisting one on first use.
     */
    public String colorFor(String material) {
        String trimmed = material == null ? "" : material.trim();
        if (trimmed.isEmpty()) {
            return DEFAULT_PALETTE.get(0);
        }
        return store.findColor(trimmed)
                .map(MaterialColor::colorHex)
                .orElseGet(() -> allocate(trimmed));
    }

    /**
     * Replaces a material's color by explicit user choice.
     */
    public MaterialColor override(String material, String colorHex) {
        if (material == null || material.isBlank()) {
            throw LedgerException.invalidInput("Material name is required");
        }
        String hex = HexColor.normalize(colorHex);
        if (hex == null) {
            throw LedgerException.invalidInput("Color must be a 6-digit hex value, got " + colorHex);
        }
        String displayName = store.findColor(material).map(MaterialColor::material).orElse(material.trim());
        MaterialColor saved = store.saveColor(new MaterialColor(displayName, hex));
        LOGGER.info("MaterialColorRegistry override material={} color={}", saved.material(), saved.colorHex());
        return saved;
    }

    public List<MaterialColor> list() {
        return store.allColors();
    }

    private String allocate(String material) {
        Set<String> used = store.allColors().stream()
                .map(c -> c.colorHex().toUpperCase(Locale.ROOT))
                .collect(Collectors.toSet());
        String color = DEFAULT_PALETTE.stream()
                .filter(c -> !used.contains(c.toUpperCase(Locale.ROOT)))
                .findFirst()
                .orElseGet(() -> DEFAULT_PALETTE.get(random.nextInt(DEFAULT_PALETTE.size())));
        store.saveColor(new MaterialColor(material, color));
        LOGGER.info("MaterialColorRegistry allocated material={} color={}", material, color);
        return color;
    }
}
