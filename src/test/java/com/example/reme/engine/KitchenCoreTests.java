package com.example.reme.engine;

import com.example.reme.TestKitchen;
import com.example.reme.model.InventoryItem;
import com.example.reme.services.RecipeScore;
import com.example.reme.storage.Domain;
import com.example.reme.storage.ImportMode;
import com.example.reme.storage.Settings;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

import static com.example.reme.TestKitchen.*;
import static org.junit.jupiter.api.Assertions.*;

public class KitchenCoreTests {
    @TempDir
    Path dir;

    private static KitchenCore seeded() {
        return KitchenCore.inMemory(new Settings(), new TestKitchen.MutableClock(NOW), new Random(7));
    }

    @Test
    void seeded_core_resolves_informal_names() {
        try (KitchenCore core = seeded()) {
            assertEquals("ing_tomate", core.ingredients().findByName("jitomate").orElseThrow().id);
            assertEquals("ing_aguacate", core.ingredients().findByName("palta").orElseThrow().id);
            assertEquals(List.of("Refrigerador", "Congelador", "Alacena"), core.locations().getNames());
        }
    }

    @Test
    void ingredient_search_over_bundled_recipes() {
        try (KitchenCore core = seeded()) {
            List<RecipeScore> results = core.cookSearch().getRecipesByIngredients(
                    List.of("jitomate", "cebolla", "chile", "cilantro", "sal"));
            List<String> ids = results.stream().map(s -> s.recipe.id).collect(Collectors.toList());

            assertEquals("recipe_salsa_mexicana", ids.get(0));
            assertEquals(1.0, results.get(0).matchPercentage, 1e-9);
            assertFalse(ids.contains("recipe_pollo_papas"));
            assertFalse(ids.contains("recipe_hotcakes"));
        }
    }

    @Test
    void daily_pick_exists_without_history() {
        try (KitchenCore core = seeded()) {
            assertTrue(core.recommendations().getDailyRecommendation().orElseThrow().isRandom());
            assertTrue(core.recommendations().getDailyRecommendation().orElseThrow().fromCache);
        }
    }

    @Test
    void file_backed_core_keeps_data_between_sessions() {
        Settings settings = new Settings();
        settings.dataDirectory = dir.toString();

        String itemId;
        try (KitchenCore core = KitchenCore.open(settings)) {
            itemId = core.inventory().add(stock(null, "ing_tomate", 3, "pieza", "Refrigerador", null)).id;
        }
        try (KitchenCore core = KitchenCore.open(settings)) {
            InventoryItem item = core.inventory().getById(itemId).orElseThrow();
            assertEquals(3, item.quantity, 1e-9);
            assertEquals(27, core.ingredients().getAll().size());
            assertEquals(3, core.locations().getAll().size());
        }
    }

    @Test
    void snapshot_moves_between_cores() throws Exception {
        String snapshot;
        try (KitchenCore core = seeded()) {
            core.inventory().add(stock(null, "ing_huevo", 12, "pieza", "Refrigerador", TODAY.plusDays(10)));
            snapshot = core.transfer().export(Domain.INVENTORY);
        }
        try (KitchenCore other = kitchen(new TestKitchen.MutableClock(NOW))) {
            assertEquals(1, other.transfer().importJson(Domain.INVENTORY, snapshot, ImportMode.MERGE).success);
            assertEquals(12, other.inventory().getTotalQuantity("ing_huevo").total, 1e-9);
        }
    }
}
