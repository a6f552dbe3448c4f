package com.example.reme.engine;

import com.example.reme.services.*;
import com.example.reme.storage.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Random;

/**
 * Explicitly constructed handle wiring one store, settings, clock and random source into every
 * service. Callers hold on to it instead of reaching for a process-wide connection; tests build
 * one over an in-memory store.
 */
public class KitchenCore implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(KitchenCore.class);

    private final RecordStore store;
    private final Settings settings;
    private final IngredientMatcher matcher;
    private final IngredientService ingredients;
    private final InventoryService inventory;
    private final LocationService locations;
    private final RecipeService recipes;
    private final RecipeHistoryService history;
    private final RecommendationService recommendations;
    private final CookSearchService cookSearch;
    private final DataTransfer transfer;

    public KitchenCore(RecordStore store, Settings settings, AliasResolver aliases, Units units, Clock clock, Random random) {
        this.store = store;
        this.settings = settings;
        boolean seed = settings.seedSampleData();
        this.matcher = new IngredientMatcher(store, aliases, settings.fuzzyThreshold());
        this.ingredients = new IngredientService(store, matcher, seed ? IngredientService.DEFAULT_SEED : null);
        this.recipes = new RecipeService(store, seed ? RecipeService.DEFAULT_SEED : null);
        this.locations = new LocationService(store);
        this.inventory = new InventoryService(store, ingredients, units, clock);
        this.history = new RecipeHistoryService(store, recipes, clock);
        RecipeScorer scorer = new RecipeScorer();
        this.recommendations = new RecommendationService(store, recipes, inventory, history, scorer, settings, clock, random);
        this.cookSearch = new CookSearchService(store, recipes, ingredients, inventory, scorer, settings, clock);
        this.transfer = new DataTransfer(store, clock);
    }

    /** Opens the JSON file store under the configured data directory with the bundled tables. */
    public static KitchenCore open(Settings settings) {
        Path dir = Path.of(settings.dataDirectory);
        log.info("Opening kitchen data in {}", dir);
        RecordStore store = RecordStore.open(new JsonFileBackend(dir), Stores.schemas());
        return new KitchenCore(store, settings, AliasResolver.defaults(), Units.defaults(), Clock.systemDefaultZone(), new Random());
    }

    /** Volatile store, for tests and demos. */
    public static KitchenCore inMemory(Settings settings, Clock clock, Random random) {
        return new KitchenCore(RecordStore.inMemory(Stores.schemas()), settings, AliasResolver.defaults(), Units.defaults(), clock, random);
    }

    public RecordStore store() { return store; }
    public Settings settings() { return settings; }
    public IngredientMatcher matcher() { return matcher; }
    public IngredientService ingredients() { return ingredients; }
    public InventoryService inventory() { return inventory; }
    public LocationService locations() { return locations; }
    public RecipeService recipes() { return recipes; }
    public RecipeHistoryService history() { return history; }
    public RecommendationService recommendations() { return recommendations; }
    public CookSearchService cookSearch() { return cookSearch; }
    public DataTransfer transfer() { return transfer; }

    @Override
    public void close() {
        matcher.close();
        store.close();
    }
}
