package com.example.reme.model;

/** Score breakdown of a daily recommendation; all zero for a random pick. */
public class RecommendationFactors {
    public double inventoryMatchScore;   // 0..1
    public double ratingScore;           // 0..1
    public double frequencyScore;        // 0..1
    public double finalScore;            // weighted sum

    public RecommendationFactors() {}
    public RecommendationFactors(double inventoryMatchScore, double ratingScore, double frequencyScore, double finalScore) {
        this.inventoryMatchScore = inventoryMatchScore; this.ratingScore = ratingScore;
        this.frequencyScore = frequencyScore; this.finalScore = finalScore;
    }

    public static RecommendationFactors none() { return new RecommendationFactors(0, 0, 0, 0); }

    @Override public String toString() {
        return String.format("Inventory: %.0f%%  |  Rating: %.2f  |  Variety: %.2f  =>  Score: %.3f",
                inventoryMatchScore * 100.0, ratingScore, frequencyScore, finalScore);
    }
}
