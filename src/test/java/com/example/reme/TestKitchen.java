package com.example.reme;

import com.example.reme.engine.KitchenCore;
import com.example.reme.model.*;
import com.example.reme.services.AliasResolver;
import com.example.reme.services.Units;
import com.example.reme.storage.RecordStore;
import com.example.reme.storage.Settings;
import com.example.reme.storage.Stores;

import java.time.*;
import java.util.*;

/** Shared fixtures: an unseeded in-memory kitchen on a clock the test can move. */
public final class TestKitchen {
    public static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");
    public static final LocalDate TODAY = LocalDate.of(2026, 3, 10);

    private TestKitchen() {}

    public static class MutableClock extends Clock {
        private Instant instant;
        public MutableClock(Instant instant) { this.instant = instant; }
        public void advance(Duration d) { instant = instant.plus(d); }
        @Override public ZoneId getZone() { return ZoneOffset.UTC; }
        @Override public Clock withZone(ZoneId zone) { return this; }
        @Override public Instant instant() { return instant; }
    }

    public static Settings settings() {
        Settings s = new Settings();
        s.seedSampleData = false;
        return s;
    }

    public static KitchenCore kitchen(MutableClock clock) {
        return new KitchenCore(RecordStore.inMemory(Stores.schemas()), settings(), AliasResolver.defaults(),
                Units.defaults(), clock, new Random(42));
    }

    public static CatalogIngredient ingredient(String id, String name, String... synonyms) {
        return new CatalogIngredient(id, name, name.toLowerCase(Locale.ROOT), "verduras", List.of(synonyms));
    }

    public static Recipe recipe(String id, String name, String... ingredientIds) {
        List<RecipeIngredient> lines = new ArrayList<>();
        for (String ingId : ingredientIds) lines.add(new RecipeIngredient(ingId, ingId, 1, "pieza"));
        Recipe r = new Recipe(id, name, lines, 20, "Fácil");
        r.servings = 2;
        return r;
    }

    public static RecipeHistory cooked(String id, String recipeId, Instant when, Integer rating) {
        RecipeHistory h = new RecipeHistory(id, recipeId, when.minus(Duration.ofHours(1)));
        h.completed = true;
        h.completedAt = when;
        h.rating = rating;
        return h;
    }

    public static InventoryItem stock(String id, String ingredientId, double qty, String unit, String location, LocalDate expires) {
        return new InventoryItem(id, ingredientId, qty, unit, location, expires);
    }
}
