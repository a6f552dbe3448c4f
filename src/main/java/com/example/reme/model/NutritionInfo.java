package com.example.reme.model;

/** Nutrition per {@code per} units (normally 100 g or 100 ml). */
public class NutritionInfo {
    public double per = 100;
    public String unit = "g";
    public double calories;
    public double protein;
    public double carbs;
    public double fat;
    public double fiber;
    public Double sugar;    // nullable
    public Double sodium;   // nullable, mg

    public NutritionInfo() {}
    public NutritionInfo(double calories, double protein, double carbs, double fat, double fiber) {
        this.calories = calories; this.protein = protein; this.carbs = carbs; this.fat = fat; this.fiber = fiber;
    }
}
