package com.example.reme.services;

import com.example.reme.model.Recipe;
import com.example.reme.model.RecipeIngredient;
import com.example.reme.storage.BulkWriteResult;
import com.example.reme.storage.JsonStorage;
import com.example.reme.storage.RecordStore;
import com.example.reme.storage.Stores;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.*;

/** Read side of the recipe collection, seeded from the bundled recipes on first read. */
public class RecipeService {
    private static final Logger log = LoggerFactory.getLogger(RecipeService.class);
    public static final String DEFAULT_SEED = "/sample-data/recipes.json";

    private final RecordStore store;
    private final String seedResource;   // null disables seeding

    public RecipeService(RecordStore store, String seedResource) {
        this.store = store;
        this.seedResource = seedResource;
    }

    public int initializeCache() {
        if (seedResource == null || store.count(Stores.RECIPES) > 0) return 0;
        List<Recipe> seed;
        try (InputStream in = JsonStorage.resource(seedResource)) {
            seed = new JsonStorage().loadRecipes(in);
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot load recipes from " + seedResource, ex);
        }
        BulkWriteResult result = store.bulkPut(Stores.RECIPES, seed);
        log.info("Initialized {} recipes in cache", result.written);
        return result.written;
    }

    public int refreshCache() {
        store.clear(Stores.RECIPES);
        return initializeCache();
    }

    public List<Recipe> getAll() {
        initializeCache();
        return store.getAll(Stores.RECIPES, Recipe.class);
    }

    public Optional<Recipe> getById(String id) {
        if (id == null) return Optional.empty();
        initializeCache();
        return store.get(Stores.RECIPES, id, Recipe.class);
    }

    public Recipe save(Recipe recipe) {
        if (recipe.id == null) recipe.id = Stores.newId("recipe");
        return store.put(Stores.RECIPES, recipe);
    }

    /** Case-insensitive substring search over name, description, tags and cuisine. */
    public List<Recipe> search(String query) {
        if (query == null || query.isBlank()) return getAll();
        String q = query.trim().toLowerCase(Locale.ROOT);
        List<Recipe> out = new ArrayList<>();
        for (Recipe r : getAll()) {
            if (contains(r.name, q) || contains(r.description, q) || contains(r.cuisine, q)
                    || (r.tags != null && r.tags.stream().anyMatch(t -> contains(t, q)))) {
                out.add(r);
            }
        }
        return out;
    }

    public List<Recipe> getByCategory(String category) {
        initializeCache();
        return store.getByIndex(Stores.RECIPES, "category", category, Recipe.class);
    }

    public List<Recipe> getByDifficulty(String difficulty) {
        initializeCache();
        return store.getByIndex(Stores.RECIPES, "difficulty", difficulty, Recipe.class);
    }

    /** Recipes that take at most {@code maxMinutes}, quickest first. */
    public List<Recipe> getByTime(int maxMinutes) {
        List<Recipe> out = new ArrayList<>();
        for (Recipe r : getAll()) if (r.time <= maxMinutes) out.add(r);
        out.sort(Comparator.comparingInt(r -> r.time));
        return out;
    }

    public List<Recipe> getWithIngredient(String ingredientId) {
        List<Recipe> out = new ArrayList<>();
        for (Recipe r : getAll()) {
            if (r.ingredients == null) continue;
            for (RecipeIngredient ri : r.ingredients) {
                if (Objects.equals(ri.ingredientId, ingredientId)) {
                    out.add(r);
                    break;
                }
            }
        }
        return out;
    }

    public List<String> getCategories() {
        Set<String> out = new LinkedHashSet<>();
        for (Recipe r : getAll()) if (r.category != null) out.add(r.category);
        return new ArrayList<>(out);
    }

    private static boolean contains(String s, String q) {
        return s != null && s.toLowerCase(Locale.ROOT).contains(q);
    }
}
