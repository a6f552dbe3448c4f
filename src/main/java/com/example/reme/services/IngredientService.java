package com.example.reme.services;

import com.example.reme.model.CatalogIngredient;
import com.example.reme.storage.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.*;

/**
 * The shared ingredient catalog. When a seed resource is configured, an empty catalog is
 * filled from it on first read.
 */
public class IngredientService {
    private static final Logger log = LoggerFactory.getLogger(IngredientService.class);
    public static final String DEFAULT_SEED = "/sample-data/ingredients.json";
    public static final int DEFAULT_SEARCH_LIMIT = 20;

    private final RecordStore store;
    private final IngredientMatcher matcher;
    private final String seedResource;   // null disables seeding

    public IngredientService(RecordStore store, IngredientMatcher matcher, String seedResource) {
        this.store = store;
        this.matcher = matcher;
        this.seedResource = seedResource;
    }

    /** Loads the seed catalog when the collection is empty; returns how many entries were added. */
    public int initializeCache() {
        if (seedResource == null || store.count(Stores.INGREDIENTS) > 0) return 0;
        List<CatalogIngredient> seed = loadSeed();
        BulkWriteResult result = store.bulkPut(Stores.INGREDIENTS, seed);
        log.info("Initialized {} ingredients in cache", result.written);
        return result.written;
    }

    /** Drops the catalog and reloads it from the seed resource. */
    public int refreshCache() {
        store.clear(Stores.INGREDIENTS);
        return initializeCache();
    }

    public List<CatalogIngredient> getAll() {
        initializeCache();
        return store.getAll(Stores.INGREDIENTS, CatalogIngredient.class);
    }

    public Optional<CatalogIngredient> getById(String id) {
        if (id == null) return Optional.empty();
        initializeCache();
        return store.get(Stores.INGREDIENTS, id, CatalogIngredient.class);
    }

    /** Entries for the given ids in the order given; unknown ids are skipped. */
    public List<CatalogIngredient> getByIds(Collection<String> ids) {
        List<CatalogIngredient> out = new ArrayList<>();
        for (String id : ids) getById(id).ifPresent(out::add);
        return out;
    }

    public List<CatalogIngredient> search(String query) { return search(query, null, DEFAULT_SEARCH_LIMIT); }

    /**
     * Substring search over display name, normalized name and synonyms, optionally within one
     * category. Exact name hits come first.
     */
    public List<CatalogIngredient> search(String query, String category, int limit) {
        List<CatalogIngredient> results = category != null ? getByCategory(category) : getAll();
        if (query != null && !query.isBlank()) {
            String lower = query.trim().toLowerCase(Locale.ROOT);
            String normalized = NameNormalizer.normalize(query);
            List<CatalogIngredient> exact = new ArrayList<>();
            List<CatalogIngredient> partial = new ArrayList<>();
            for (CatalogIngredient ing : results) {
                boolean isExact = lower.equals(lower(ing.name)) || normalized.equals(NameNormalizer.normalize(normalizedOf(ing)));
                if (isExact) exact.add(ing);
                else if (matchesQuery(ing, lower, normalized)) partial.add(ing);
            }
            results = new ArrayList<>(exact);
            results.addAll(partial);
        }
        return results.size() > limit ? new ArrayList<>(results.subList(0, limit)) : results;
    }

    public List<CatalogIngredient> getByCategory(String category) {
        initializeCache();
        return store.getByIndex(Stores.INGREDIENTS, "category", category, CatalogIngredient.class);
    }

    public List<CatalogIngredient> getCommon() {
        initializeCache();
        return store.getByIndex(Stores.INGREDIENTS, "isCommon", true, CatalogIngredient.class);
    }

    public List<String> getCategories() {
        Set<String> out = new LinkedHashSet<>();
        for (CatalogIngredient ing : getAll()) if (ing.category != null) out.add(ing.category);
        return new ArrayList<>(out);
    }

    public List<CatalogIngredient> getSubstitutes(String ingredientId) {
        return getById(ingredientId).map(ing -> getByIds(ing.substitutes)).orElse(List.of());
    }

    public List<CatalogIngredient> getCompatible(String ingredientId) {
        return getById(ingredientId).map(ing -> getByIds(ing.compatibleWith)).orElse(List.of());
    }

    /** Same as duplicate detection, falling back to a fuzzy hit above the default threshold. */
    public Optional<CatalogIngredient> findByName(String name) {
        initializeCache();
        Optional<CatalogIngredient> existing = matcher.findExisting(name);
        if (existing.isPresent()) return existing;
        List<IngredientMatcher.Match> fuzzy = matcher.fuzzySearch(name);
        return fuzzy.isEmpty() ? Optional.empty() : Optional.of(fuzzy.get(0).ingredient);
    }

    /** True when both names resolve to the same catalog entry. */
    public boolean areSame(String a, String b) {
        if (NameNormalizer.normalize(a).equals(NameNormalizer.normalize(b))) return true;
        initializeCache();
        Optional<CatalogIngredient> ia = matcher.findExisting(a);
        Optional<CatalogIngredient> ib = matcher.findExisting(b);
        return ia.isPresent() && ib.isPresent() && ia.get().id.equals(ib.get().id);
    }

    /**
     * Adds a new catalog entry, filling normalized name, id and automatic synonyms when absent.
     *
     * @throws ConstraintViolationException when the name already resolves to an entry
     */
    public CatalogIngredient addIngredient(CatalogIngredient ingredient) {
        if (ingredient.name == null || ingredient.name.isBlank()) throw new IllegalArgumentException("Ingredient name is required");
        initializeCache();
        Optional<CatalogIngredient> existing = matcher.findExisting(ingredient.name);
        if (existing.isPresent()) {
            throw new ConstraintViolationException("Ingredient '" + ingredient.name + "' already exists as " + existing.get());
        }
        if (ingredient.normalizedName == null) ingredient.normalizedName = NameNormalizer.normalize(ingredient.name);
        if (ingredient.id == null) ingredient.id = Stores.newId("ing");
        if (ingredient.synonyms == null || ingredient.synonyms.isEmpty()) {
            List<String> auto = new ArrayList<>(matcher.generateAutomaticSynonyms(ingredient.name));
            auto.remove(ingredient.normalizedName);
            ingredient.synonyms = auto;
        }
        store.add(Stores.INGREDIENTS, ingredient);
        log.info("Added catalog ingredient {}", ingredient);
        return ingredient;
    }

    /** @throws RecordNotFoundException when there is no entry with that id */
    public CatalogIngredient updateIngredient(CatalogIngredient ingredient) {
        if (getById(ingredient.id).isEmpty()) {
            throw new RecordNotFoundException(Stores.INGREDIENTS, ingredient.id, "Ingredient not found: " + ingredient.id);
        }
        return store.put(Stores.INGREDIENTS, ingredient);
    }

    /** Display name for an id, falling back to "Ingrediente desconocido" for dangling references. */
    public String displayName(String ingredientId) {
        return getById(ingredientId).map(ing -> ing.name).orElse(RecipeScorer.UNKNOWN_INGREDIENT);
    }

    private boolean matchesQuery(CatalogIngredient ing, String lower, String normalized) {
        if (lower(ing.name).contains(lower)) return true;
        if (NameNormalizer.normalize(normalizedOf(ing)).contains(normalized)) return true;
        if (ing.synonyms != null) {
            for (String syn : ing.synonyms) if (lower(syn).contains(lower)) return true;
        }
        return false;
    }

    private List<CatalogIngredient> loadSeed() {
        try (InputStream in = JsonStorage.resource(seedResource)) {
            return new JsonStorage().loadIngredients(in);
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot load ingredient catalog from " + seedResource, ex);
        }
    }

    private static String normalizedOf(CatalogIngredient ing) {
        return ing.normalizedName != null ? ing.normalizedName : ing.name;
    }

    private static String lower(String s) { return s == null ? "" : s.toLowerCase(Locale.ROOT); }
}
