package com.example.filament_ledger.service;

import com.example.filament_ledger.ledger.LedgerException;
import com.example.filament_ledger.ledger.MaterialColor;
import com.example.filament_ledger.store.InMemoryInventoryStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MaterialColorRegistryTest {
    private InMemoryInventoryStore store;
    private MaterialColorRegistry registry;

    @BeforeEach
    void setup() {
        store = new InMemoryInventoryStore();
        registry = new MaterialColorRegistry(store, new Random(42));
    }

    @Test
    void seedingIsIdempotent() {
        assertThat(registry.ensureSeeded()).isEqualTo(14);
        assertThat(registry.ensureSeeded()).isZero();

        assertThat(store.allColors()).hasSize(14);
        assertThat(store.findColor("PLA")).map(MaterialColor::colorHex).contains("#7FD4B0");
        assertThat(store.findColor("wood")).map(MaterialColor::colorHex).contains("#7FD4B0");
    }

    @Test
    void seedingSkipsNonEmptyRegistry() {
        store.saveColor(new MaterialColor("Nylon", "#123456"));

        assertThat(registry.ensureSeeded()).isZero();
        assertThat(store.allColors()).hasSize(1);
    }

    @Test
    void lookupIsCaseInsensitiveAndStable() {
        String first = registry.colorFor("PETG");

        assertThat(registry.colorFor("petg")).isEqualTo(first);
        assertThat(registry.colorFor(" Petg ")).isEqualTo(first);
        assertThat(store.allColors()).hasSize(1);
    }

    @Test
    void allocationTakesFirstUnusedPaletteColor() {
        store.saveColor(new MaterialColor("PLA", "#7fd4b0"));

        assertThat(registry.colorFor("ABS")).isEqualTo("#B88A5A");
        assertThat(registry.colorFor("TPU")).isEqualTo("#8BC5D9");
    }

    @Test
    void exhaustedPaletteFallsBackToPaletteColor() {
        for (int i = 0; i < MaterialColorRegistry.DEFAULT_PALETTE.size(); i++) {
            store.saveColor(new MaterialColor("M" + i, MaterialColorRegistry.DEFAULT_PALETTE.get(i)));
        }

        String color = registry.colorFor("Exotic");

        assertThat(MaterialColorRegistry.DEFAULT_PALETTE).contains(color);
        assertThat(store.findColor("exotic")).map(MaterialColor::colorHex).contains(color);
    }

    @Test
    void blankMaterialIsNotPersisted() {
        assertThat(registry.colorFor("  ")).isEqualTo(MaterialColorRegistry.DEFAULT_PALETTE.get(0));
        assertThat(store.allColors()).isEmpty();
    }

    @Test
    void overrideReplacesColorAndKeepsDisplayName() {
        registry.colorFor("Silk");

        MaterialColor saved = registry.override("SILK", "abcdef");

        assertThat(saved.material()).isEqualTo("Silk");
        assertThat(saved.colorHex()).isEqualTo("#ABCDEF");
        assertThat(registry.colorFor("silk")).isEqualTo("#ABCDEF");
    }

    @Test
    void overrideRejectsBadHex() {
        assertThatThrownBy(() -> registry.override("PLA", "red")).isInstanceOf(LedgerException.class);
    }
}
