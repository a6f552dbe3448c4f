package com.example.reme.model;

/** Ingredient line of a recipe; {@code ingredientId} is resolved against the catalog on read. */
public class RecipeIngredient {
    public String ingredientId;
    public String displayName;
    public double amount;
    public String unit;
    public String preparation;
    public boolean optional;

    public RecipeIngredient() {}
    public RecipeIngredient(String ingredientId, String displayName, double amount, String unit) {
        this.ingredientId = ingredientId; this.displayName = displayName; this.amount = amount; this.unit = unit;
    }
}
