package com.example.reme.storage;

import com.example.reme.model.CatalogIngredient;
import com.example.reme.model.InventoryItem;
import com.example.reme.model.Recipe;
import com.example.reme.model.RecipeHistory;

/**
 * Exportable data sets, each bound to a store collection and a snapshot property name.
 * Domains read back through a model class name it as {@code modelType}; the others are kept as raw JSON.
 */
public enum Domain {
    INGREDIENTS("ingredients", Stores.INGREDIENTS, CatalogIngredient.class),
    RECIPES("recipes", Stores.RECIPES, Recipe.class),
    APPLIANCES("appliances", Stores.APPLIANCES, null),
    INVENTORY("inventory", Stores.INVENTORY, InventoryItem.class),
    USER_APPLIANCES("userAppliances", Stores.USER_APPLIANCES, null),
    RECIPE_HISTORY("recipeHistory", Stores.RECIPE_HISTORY, RecipeHistory.class);

    public final String key;
    public final String collection;
    public final Class<?> modelType;   // nullable

    Domain(String key, String collection, Class<?> modelType) {
        this.key = key; this.collection = collection; this.modelType = modelType;
    }

    public static Domain fromKey(String key) {
        for (Domain d : values()) if (d.key.equals(key)) return d;
        throw new IllegalArgumentException("Unknown domain: " + key);
    }
}
