package com.example.reme;

import com.example.reme.engine.KitchenCore;
import com.example.reme.model.*;
import com.example.reme.services.*;
import com.example.reme.storage.Settings;
import com.example.reme.storage.SettingsStorage;

import java.time.LocalDate;
import java.util.*;

/**
 * Minimal CLI demo: stocks a few ingredients, then prints the daily pick, a search by
 * ingredient names and the inventory alerts. Pass {@code --memory} to leave no files behind.
 */
public class CliDemo {
    public static void main(String[] args) {
        Settings settings = new SettingsStorage().load();
        boolean memory = Arrays.asList(args).contains("--memory");
        try (KitchenCore core = memory
                ? KitchenCore.inMemory(settings, java.time.Clock.systemDefaultZone(), new Random())
                : KitchenCore.open(settings)) {

            System.out.println("Locations: " + core.locations().getNames());

            List<String> names = List.of("jitomate", "cebolla", "huevo");
            for (String name : names) {
                Optional<CatalogIngredient> ing = core.ingredients().findByName(name);
                if (ing.isEmpty()) {
                    System.out.println(" ? " + name + " not in catalog");
                    continue;
                }
                InventoryItem item = new InventoryItem(null, ing.get().id, 2, "pieza", "Refrigerador", LocalDate.now().plusDays(3));
                core.inventory().add(item);
                System.out.println(" + " + name + " -> " + ing.get().name);
            }

            System.out.println("\nDaily recommendation:");
            core.recommendations().getDailyRecommendation()
                .ifPresentOrElse(r -> System.out.println(" - " + r), () -> System.out.println(" - (no recipes)"));

            System.out.println("\nRecipes for " + names + ":");
            for (RecipeScore s : core.cookSearch().getRecipesByIngredients(names)) {
                System.out.println(" - " + s + "  missing=" + s.missingIngredients);
            }

            System.out.println("\nAlerts:");
            for (InventoryAlert a : core.inventory().generateAlerts()) System.out.println(" - " + a);
        }
    }
}
