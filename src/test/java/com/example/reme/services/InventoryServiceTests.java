package com.example.reme.services;

import com.example.reme.TestKitchen;
import com.example.reme.engine.KitchenCore;
import com.example.reme.model.InventoryAlert;
import com.example.reme.model.InventoryItem;
import com.example.reme.model.RecipeIngredient;
import com.example.reme.storage.RecordNotFoundException;
import com.example.reme.storage.Stores;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static com.example.reme.TestKitchen.*;
import static org.junit.jupiter.api.Assertions.*;

public class InventoryServiceTests {
    private KitchenCore core;
    private InventoryService inventory;

    @BeforeEach
    void setUp() {
        core = kitchen(new TestKitchen.MutableClock(NOW));
        inventory = core.inventory();
        core.store().put(Stores.INGREDIENTS, ingredient("ing_tomate", "Tomate"));
        core.store().put(Stores.INGREDIENTS, ingredient("ing_cebolla", "Cebolla"));
        core.store().put(Stores.INGREDIENTS, ingredient("ing_cilantro", "Cilantro"));
    }

    @Test
    void new_items_get_id_purchase_date_and_timestamps() {
        InventoryItem item = inventory.add(stock(null, "ing_tomate", 1, "kg", "Refrigerador", null));
        assertTrue(item.id.startsWith("inv_"));
        assertEquals(TODAY, item.purchaseDate);
        assertEquals(NOW, item.createdAt);
        assertEquals(NOW, inventory.getById(item.id).orElseThrow().updatedAt);
    }

    @Test
    void same_ingredient_and_location_fold_when_units_allow() {
        InventoryItem first = inventory.add(stock(null, "ing_tomate", 1, "kg", "Refrigerador", TODAY.plusDays(4)));
        InventoryItem folded = inventory.add(stock(null, "ing_tomate", 500, "gramos", "Refrigerador", null));

        assertEquals(first.id, folded.id);
        assertEquals(1.5, inventory.getById(first.id).orElseThrow().quantity, 1e-9);
        assertEquals(TODAY.plusDays(4), inventory.getById(first.id).orElseThrow().expirationDate);

        inventory.add(stock(null, "ing_tomate", 2, "pieza", "Refrigerador", null));
        inventory.add(stock(null, "ing_tomate", 1, "kg", "Alacena", null));
        assertEquals(3, inventory.getByIngredientId("ing_tomate").size());
    }

    @Test
    void invalid_adds_and_missing_updates_are_rejected() {
        assertThrows(IllegalArgumentException.class, () -> inventory.add(stock(null, "ing_tomate", -1, "kg", "Alacena", null)));
        assertThrows(IllegalArgumentException.class, () -> inventory.add(stock(null, null, 1, "kg", "Alacena", null)));
        assertThrows(RecordNotFoundException.class, () -> inventory.update(stock("inv_missing", "ing_tomate", 1, "kg", "Alacena", null)));
    }

    @Test
    void consume_drains_soonest_expiring_batches_first() {
        core.store().put(Stores.INVENTORY, stock("a", "ing_cebolla", 2, "pieza", "Refrigerador", TODAY.plusDays(5)));
        core.store().put(Stores.INVENTORY, stock("b", "ing_cebolla", 1, "pieza", "Alacena", TODAY.plusDays(1)));
        core.store().put(Stores.INVENTORY, stock("c", "ing_cebolla", 3, "pieza", "Alacena", null));

        InventoryService.ConsumeResult result = inventory.consume("ing_cebolla", 2, null);

        assertEquals(2, result.consumed, 1e-9);
        assertEquals(4, result.remaining, 1e-9);
        assertTrue(inventory.getById("b").isEmpty());
        assertEquals(1, inventory.getById("a").orElseThrow().quantity, 1e-9);
        assertEquals(3, inventory.getById("c").orElseThrow().quantity, 1e-9);
    }

    @Test
    void consume_prefers_the_given_location() {
        core.store().put(Stores.INVENTORY, stock("a", "ing_cebolla", 2, "pieza", "Refrigerador", TODAY.plusDays(5)));
        core.store().put(Stores.INVENTORY, stock("b", "ing_cebolla", 1, "pieza", "Alacena", TODAY.plusDays(1)));
        core.store().put(Stores.INVENTORY, stock("c", "ing_cebolla", 3, "pieza", "Alacena", null));

        InventoryService.ConsumeResult result = inventory.consume("ing_cebolla", 5, "Refrigerador");

        assertEquals(5, result.consumed, 1e-9);
        assertEquals(1, result.remaining, 1e-9);
        assertEquals(List.of("c"), inventory.getByIngredientId("ing_cebolla").stream().map(i -> i.id).collect(Collectors.toList()));
    }

    @Test
    void consume_more_than_available_empties_the_stock() {
        core.store().put(Stores.INVENTORY, stock("a", "ing_cebolla", 2, "pieza", "Alacena", null));
        InventoryService.ConsumeResult result = inventory.consume("ing_cebolla", 10, null);
        assertEquals(2, result.consumed, 1e-9);
        assertEquals(0, result.remaining, 1e-9);
        assertTrue(inventory.getAll().isEmpty());

        InventoryService.ConsumeResult none = inventory.consume("ing_tomate", 1, null);
        assertEquals(0, none.consumed, 1e-9);
    }

    @Test
    void alerts_cover_expiry_and_low_stock_high_priority_first() {
        core.store().put(Stores.INVENTORY, stock("i1", "ing_cebolla", 1, "pieza", "Alacena", TODAY.plusDays(1)));
        core.store().put(Stores.INVENTORY, stock("i2", "ing_tomate", 1, "pieza", "Alacena", TODAY.minusDays(3)));
        core.store().put(Stores.INVENTORY, stock("i3", "ing_cilantro", 1, "manojo", "Refrigerador", TODAY));
        core.store().put(Stores.INVENTORY, stock("i4", "ing_cebolla", 1, "pieza", "Refrigerador", TODAY.plusDays(2)));
        core.store().put(Stores.INVENTORY, stock("i5", "ing_tomate", 1, "pieza", "Congelador", TODAY.plusDays(3)));
        InventoryItem empty = stock("i6", "ing_ghost", 0, "kg", "Alacena", null);
        empty.lowStockThreshold = 1.0;
        core.store().put(Stores.INVENTORY, empty);
        InventoryItem low = stock("i7", "ing_tomate", 0.5, "kg", "Refrigerador", null);
        low.lowStockThreshold = 1.0;
        core.store().put(Stores.INVENTORY, low);

        List<InventoryAlert> alerts = inventory.generateAlerts();
        List<String> messages = alerts.stream().map(a -> a.message).collect(Collectors.toList());

        assertEquals(List.of(
                "Tomate ha caducado hace 3 días",
                "Cilantro caduca hoy",
                "Ingrediente desconocido está agotado",
                "Cebolla caduca mañana",
                "Cebolla caduca en 2 días",
                "Tomate tiene poco stock (0.5 kg)"), messages);
        assertEquals(InventoryAlert.Type.EXPIRED, alerts.get(0).type);
        assertEquals(InventoryAlert.Priority.HIGH, alerts.get(2).priority);
        assertEquals(InventoryAlert.Priority.MEDIUM, alerts.get(3).priority);
        assertEquals(TODAY, alerts.get(0).date);
        assertEquals(2, inventory.getLowStock().size());
    }

    @Test
    void expiring_includes_expired_and_skips_undated() {
        core.store().put(Stores.INVENTORY, stock("old", "ing_tomate", 1, "pieza", "Alacena", TODAY.minusDays(1)));
        core.store().put(Stores.INVENTORY, stock("soon", "ing_tomate", 1, "pieza", "Refrigerador", TODAY.plusDays(2)));
        core.store().put(Stores.INVENTORY, stock("later", "ing_tomate", 1, "pieza", "Alacena", TODAY.plusDays(3)));
        core.store().put(Stores.INVENTORY, stock("undated", "ing_tomate", 1, "pieza", "Alacena", null));

        List<String> ids = inventory.getExpiring(2).stream().map(i -> i.id).collect(Collectors.toList());
        assertEquals(List.of("old", "soon"), ids);
        assertEquals(1, inventory.getInventory("Alacena", 2).size());
        assertEquals(3, inventory.getInventory("Alacena", null).size());
    }

    @Test
    void totals_convert_into_the_first_batch_unit() {
        inventory.add(stock(null, "ing_tomate", 1, "kg", "Refrigerador", null));
        inventory.add(stock(null, "ing_tomate", 500, "g", "Alacena", null));

        InventoryService.QuantitySummary total = inventory.getTotalQuantity("ing_tomate");
        assertEquals(1.5, total.total, 1e-9);
        assertEquals("kg", total.unit);
        assertEquals(0.5, total.byLocation.get("Alacena"), 1e-9);
        assertEquals("", inventory.getTotalQuantity("ing_cebolla").unit);
    }

    @Test
    void recipe_check_splits_available_missing_and_optional() {
        inventory.add(stock(null, "ing_tomate", 1.5, "kg", "Refrigerador", null));
        inventory.add(stock(null, "ing_cebolla", 1, "pieza", "Refrigerador", null));

        RecipeIngredient cilantro = new RecipeIngredient("ing_cilantro", "Cilantro", 1, "manojo");
        cilantro.optional = true;
        InventoryService.RecipeAvailability check = inventory.checkRecipeIngredients(List.of(
                new RecipeIngredient("ing_tomate", "Tomate", 500, "g"),
                new RecipeIngredient("ing_cebolla", "Cebolla", 2, "pieza"),
                new RecipeIngredient("ing_huevo", "Huevo", 3, "pieza"),
                cilantro));

        assertEquals(1, check.available.size());
        assertEquals(0.5, check.available.get(0).required, 1e-9);
        assertEquals(2, check.missing.size());
        assertEquals(1, check.missing.get(0).shortage(), 1e-9);
        assertEquals(3, check.missing.get(1).shortage(), 1e-9);
        assertEquals(1, check.optional.size());
        assertFalse(check.canMake());
    }
}
