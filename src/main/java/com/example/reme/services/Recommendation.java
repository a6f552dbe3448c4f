package com.example.reme.services;

import com.example.reme.model.Recipe;
import com.example.reme.model.RecommendationFactors;

/** The daily pick. {@code factors} are all zero when it was drawn at random. */
public class Recommendation {
    public final Recipe recipe;
    public final RecommendationFactors factors;
    public final boolean fromCache;

    public Recommendation(Recipe recipe, RecommendationFactors factors, boolean fromCache) {
        this.recipe = recipe; this.factors = factors; this.fromCache = fromCache;
    }

    public boolean isRandom() { return factors.finalScore == 0; }

    @Override public String toString() { return recipe.name + "  |  " + factors + (fromCache ? "  (cached)" : ""); }
}
