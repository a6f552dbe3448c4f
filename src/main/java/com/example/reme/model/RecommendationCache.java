package com.example.reme.model;

import java.time.Instant;

public class RecommendationCache {
    public String id;
    public String recipeId;
    public double score;
    public RecommendationFactors factors;
    public Instant generatedAt;

    public RecommendationCache() {}
    public RecommendationCache(String id, String recipeId, RecommendationFactors factors, Instant generatedAt) {
        this.id = id; this.recipeId = recipeId; this.factors = factors; this.generatedAt = generatedAt;
        this.score = factors == null ? 0 : factors.finalScore;
    }
}
