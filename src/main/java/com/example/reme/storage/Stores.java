package com.example.reme.storage;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/** Collection names and their index declarations. */
public final class Stores {
    public static final String INVENTORY = "inventory";
    public static final String INGREDIENTS = "ingredientsCache";
    public static final String RECIPES = "recipesCache";
    public static final String APPLIANCES = "appliancesCache";
    public static final String USER_APPLIANCES = "userAppliances";
    public static final String LOCATIONS = "locations";
    public static final String RECIPE_HISTORY = "recipeHistory";
    public static final String RECOMMENDATION_CACHE = "recommendationCache";

    private static final long RANDOM_BOUND = 78_364_164_096L; // 36^7

    private Stores() {}

    public static List<CollectionSchema> schemas() {
        return List.of(
            CollectionSchema.of(INVENTORY,
                IndexSpec.on("ingredientId"), IndexSpec.on("location"),
                IndexSpec.on("expirationDate"), IndexSpec.on("createdAt")),
            CollectionSchema.of(INGREDIENTS,
                IndexSpec.on("normalizedName"), IndexSpec.on("category"), IndexSpec.on("isCommon")),
            CollectionSchema.of(RECIPES,
                IndexSpec.on("category"), IndexSpec.on("difficulty"), IndexSpec.on("time"), IndexSpec.on("cuisine")),
            CollectionSchema.of(APPLIANCES, IndexSpec.on("category")),
            CollectionSchema.of(USER_APPLIANCES, IndexSpec.on("applianceId")),
            CollectionSchema.of(LOCATIONS, IndexSpec.uniqueOn("name"), IndexSpec.on("order")),
            CollectionSchema.of(RECIPE_HISTORY, IndexSpec.on("recipeId"), IndexSpec.on("completed")),
            CollectionSchema.of(RECOMMENDATION_CACHE)
        );
    }

    /** Prefixed, time-ordered id in the form {@code prefix_<base36 millis>_<random>}. */
    public static String newId(String prefix) {
        String random = Long.toString(ThreadLocalRandom.current().nextLong(RANDOM_BOUND), 36);
        String stamp = Long.toString(System.currentTimeMillis(), 36);
        return prefix == null || prefix.isEmpty() ? stamp + "_" + random : prefix + "_" + stamp + "_" + random;
    }
}
