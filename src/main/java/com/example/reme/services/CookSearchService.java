package com.example.reme.services;

import com.example.reme.model.*;
import com.example.reme.storage.RecordStore;
import com.example.reme.storage.Settings;
import com.example.reme.storage.Stores;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * "Cook now" rankings: recipes for a list of ingredient names (typed, spoken or seen by the
 * camera) and a general top list driven by stock and history.
 */
public class CookSearchService {
    private static final Logger log = LoggerFactory.getLogger(CookSearchService.class);
    public static final int DEFAULT_TOP_LIMIT = 10;
    public static final int TOP_RECENT_DAYS = 3;

    /** Hard filters applied before scoring. Null fields do not filter. */
    public static class Filters {
        public Integer maxTime;
        public String difficulty;

        public Filters() {}
        public Filters(Integer maxTime, String difficulty) { this.maxTime = maxTime; this.difficulty = difficulty; }
        public static Filters none() { return new Filters(); }
    }

    private final RecordStore store;
    private final RecipeService recipes;
    private final IngredientService ingredients;
    private final InventoryService inventory;
    private final RecipeScorer scorer;
    private final Settings settings;
    private final Clock clock;

    public CookSearchService(RecordStore store, RecipeService recipes, IngredientService ingredients,
                             InventoryService inventory, RecipeScorer scorer, Settings settings, Clock clock) {
        this.store = store;
        this.recipes = recipes;
        this.ingredients = ingredients;
        this.inventory = inventory;
        this.scorer = scorer;
        this.settings = settings;
        this.clock = clock;
    }

    public List<RecipeScore> getRecipesByIngredients(List<String> terms) {
        return getRecipesByIngredients(terms, Filters.none());
    }

    /**
     * Recipes that use the given ingredients, best coverage first and then by score. Recipes
     * below the match threshold are dropped.
     */
    public List<RecipeScore> getRecipesByIngredients(List<String> terms, Filters filters) {
        List<Recipe> pool = new ArrayList<>();
        for (Recipe r : recipes.getAll()) {
            if (filters != null && filters.maxTime != null && filters.maxTime > 0 && r.time > filters.maxTime) continue;
            if (filters != null && filters.difficulty != null && !filters.difficulty.equals(r.difficulty)) continue;
            pool.add(r);
        }
        if (pool.isEmpty()) return new ArrayList<>();

        List<CatalogIngredient> catalog = ingredients.getAll();
        Map<String, Set<String>> resolved = scorer.resolveTerms(terms, catalog);
        log.debug("Search terms resolved to catalog ids: {}", resolved);

        Context ctx = context(catalog);
        List<RecipeScore> out = new ArrayList<>();
        for (Recipe r : pool) {
            RecipeScore s = scorer.scoreForSearch(r, resolved, ctx.catalog, ctx.inventoryIds, ctx.history, ctx.allHistory, ctx.now);
            if (s.matchPercentage >= settings.searchMatchThreshold()) out.add(s);
        }
        out.sort(Comparator.comparingDouble((RecipeScore s) -> s.matchPercentage).reversed()
                .thenComparing(Comparator.comparingDouble((RecipeScore s) -> s.score).reversed()));
        log.info("Ingredient search {} matched {} of {} recipes", resolved.keySet(), out.size(), pool.size());
        return out;
    }

    public List<RecipeScore> getTopRecommendedRecipes() { return getTopRecommendedRecipes(DEFAULT_TOP_LIMIT); }

    /**
     * Up to {@code limit} recipes by general cooking score. Recipes cooked in the last three
     * days are left out when enough others remain.
     */
    public List<RecipeScore> getTopRecommendedRecipes(int limit) {
        List<Recipe> all = recipes.getAll();
        if (all.isEmpty() || limit <= 0) return new ArrayList<>();

        Context ctx = context(ingredients.getAll());
        List<RecipeScore> scored = new ArrayList<>();
        for (Recipe r : all) scored.add(scorer.scoreForCooking(r, ctx.catalog, ctx.inventoryIds, ctx.history, ctx.allHistory, ctx.now));
        scored.sort(Comparator.comparingDouble((RecipeScore s) -> s.score).reversed());

        Set<String> recent = RecipeScorer.recentRecipeIds(ctx.allHistory, TOP_RECENT_DAYS, ctx.now);
        List<RecipeScore> eligible = new ArrayList<>();
        for (RecipeScore s : scored) if (!recent.contains(s.recipe.id)) eligible.add(s);
        List<RecipeScore> pool = eligible.size() >= limit ? eligible : scored;
        return new ArrayList<>(pool.subList(0, Math.min(limit, pool.size())));
    }

    private static final class Context {
        Map<String, CatalogIngredient> catalog;
        Set<String> inventoryIds;
        List<RecipeHistory> allHistory;
        Map<String, RecipeScorer.HistoryStats> history;
        Instant now;
    }

    private Context context(List<CatalogIngredient> catalog) {
        Context ctx = new Context();
        ctx.catalog = new HashMap<>();
        for (CatalogIngredient ing : catalog) ctx.catalog.put(ing.id, ing);
        ctx.inventoryIds = new HashSet<>();
        for (InventoryItem i : inventory.getAll()) ctx.inventoryIds.add(i.ingredientId);
        ctx.allHistory = store.getAll(Stores.RECIPE_HISTORY, RecipeHistory.class);
        ctx.history = RecipeScorer.buildHistoryMap(ctx.allHistory);
        ctx.now = clock.instant();
        return ctx;
    }
}
