package com.example.reme.services;

import com.example.reme.model.*;
import com.example.reme.storage.RecordStore;
import com.example.reme.storage.Settings;
import com.example.reme.storage.StoreException;
import com.example.reme.storage.Stores;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Daily recipe pick. The result is cached for a day; with too little history or an empty
 * pantry it is drawn at random among recipes not cooked recently.
 */
public class RecommendationService {
    private static final Logger log = LoggerFactory.getLogger(RecommendationService.class);
    public static final String CACHE_ID = "daily_recommendation";

    private final RecordStore store;
    private final RecipeService recipes;
    private final InventoryService inventory;
    private final RecipeHistoryService history;
    private final RecipeScorer scorer;
    private final Settings settings;
    private final Clock clock;
    private final Random random;

    public RecommendationService(RecordStore store, RecipeService recipes, InventoryService inventory,
                                 RecipeHistoryService history, RecipeScorer scorer, Settings settings,
                                 Clock clock, Random random) {
        this.store = store;
        this.recipes = recipes;
        this.inventory = inventory;
        this.history = history;
        this.scorer = scorer;
        this.settings = settings;
        this.clock = clock;
        this.random = random;
    }

    /** Cached pick when still fresh, otherwise a new one (then cached). Empty only without recipes. */
    public Optional<Recommendation> getDailyRecommendation() {
        Optional<Recommendation> cached = getCachedRecommendation();
        if (cached.isPresent()) return cached;

        Optional<Recommendation> generated = generate();
        generated.ifPresent(r -> cache(r.recipe.id, r.factors));
        return generated;
    }

    /**
     * The cached pick if it is younger than the configured TTL and its recipe still exists.
     * An unreadable cache record counts as a miss.
     */
    public Optional<Recommendation> getCachedRecommendation() {
        RecommendationCache cache;
        try {
            cache = store.get(Stores.RECOMMENDATION_CACHE, CACHE_ID, RecommendationCache.class).orElse(null);
        } catch (StoreException | IllegalArgumentException ex) {
            log.warn("Ignoring unreadable recommendation cache: {}", ex.getMessage());
            return Optional.empty();
        }
        if (cache == null || cache.generatedAt == null) return Optional.empty();
        Duration age = Duration.between(cache.generatedAt, clock.instant());
        if (age.compareTo(Duration.ofHours(settings.cacheTtlHours())) >= 0) {
            log.debug("Recommendation cache expired ({} old)", age);
            return Optional.empty();
        }
        Optional<Recipe> recipe = recipes.getById(cache.recipeId);
        if (recipe.isEmpty()) {
            log.debug("Cached recipe {} no longer exists", cache.recipeId);
            return Optional.empty();
        }
        RecommendationFactors factors = cache.factors != null ? cache.factors : RecommendationFactors.none();
        return Optional.of(new Recommendation(recipe.get(), factors, true));
    }

    public void invalidateCache() {
        store.delete(Stores.RECOMMENDATION_CACHE, CACHE_ID);
    }

    private Optional<Recommendation> generate() {
        List<Recipe> all = recipes.getAll();
        if (all.isEmpty()) return Optional.empty();

        List<InventoryItem> stock = inventory.getAll();
        List<RecipeHistory> completed = history.getCompleted();
        Set<String> recent = RecipeScorer.recentRecipeIds(completed, settings.recentDaysExcluded(), clock.instant());

        if (completed.size() < settings.minHistoryForScoring() || stock.isEmpty()) {
            return Optional.of(randomPick(all, recent));
        }

        Set<String> inventoryIds = new HashSet<>();
        for (InventoryItem i : stock) inventoryIds.add(i.ingredientId);
        List<RecipeScorer.Ranked> ranked = scorer.rankDaily(all, inventoryIds, completed);
        for (RecipeScorer.Ranked r : ranked) {
            if (!recent.contains(r.recipe.id)) return Optional.of(new Recommendation(r.recipe, r.factors, false));
        }
        // every recipe was cooked recently
        RecipeScorer.Ranked top = ranked.get(0);
        return Optional.of(new Recommendation(top.recipe, top.factors, false));
    }

    private Recommendation randomPick(List<Recipe> all, Set<String> recent) {
        List<Recipe> eligible = new ArrayList<>();
        for (Recipe r : all) if (!recent.contains(r.id)) eligible.add(r);
        List<Recipe> pool = eligible.isEmpty() ? all : eligible;
        Recipe pick = pool.get(random.nextInt(pool.size()));
        log.debug("Not enough data for scoring, picked {} at random from {}", pick.id, pool.size());
        return new Recommendation(pick, RecommendationFactors.none(), false);
    }

    private void cache(String recipeId, RecommendationFactors factors) {
        try {
            store.put(Stores.RECOMMENDATION_CACHE, new RecommendationCache(CACHE_ID, recipeId, factors, clock.instant()));
        } catch (StoreException ex) {
            log.warn("Could not cache daily recommendation: {}", ex.getMessage());
        }
    }
}
