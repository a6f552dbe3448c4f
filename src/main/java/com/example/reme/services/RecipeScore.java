package com.example.reme.services;

import com.example.reme.model.Recipe;

import java.util.ArrayList;
import java.util.List;

/** Transparent breakdown of how a recipe ranked in a cooking search or the top list. */
public class RecipeScore {
    public Recipe recipe;
    public double score;
    public double matchPercentage;    // 0..1
    public List<String> missingIngredients = new ArrayList<>();

    // factors
    public double specificMatch;      // 0..1.5, 0 without search terms
    public double inventoryMatch;     // 0..1
    public double userHistory;        // 0..1, 0.5 when never cooked
    public double freshness;          // 0..1
    public int exactMatches;

    @Override public String toString() {
        return String.format(
            "%s  |  Match: %.0f%%  |  Specific: %.2f  |  Inventory: %.0f%%  |  History: %.2f  |  Fresh: %.2f  =>  Score: %.3f",
            recipe == null ? "?" : recipe.name, matchPercentage * 100.0, specificMatch, inventoryMatch * 100.0,
            userHistory, freshness, score);
    }
}
