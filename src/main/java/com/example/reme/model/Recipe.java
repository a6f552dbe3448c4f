package com.example.reme.model;

import java.util.ArrayList;
import java.util.List;

public class Recipe {
    public String id;
    public String name;
    public String description;
    public String image;
    public String category;
    public List<String> tags = new ArrayList<>();
    public String difficulty;   // "Fácil", "Intermedio", "Avanzado"
    public int time;            // total minutes
    public int servings;
    public String cuisine;
    public String source;
    public List<RecipeIngredient> ingredients = new ArrayList<>();
    public List<RecipeStep> steps = new ArrayList<>();

    public Recipe() {}
    public Recipe(String id, String name, List<RecipeIngredient> ingredients, int time, String difficulty) {
        this.id = id; this.name = name; this.ingredients = new ArrayList<>(ingredients); this.time = time; this.difficulty = difficulty;
    }

    @Override public String toString() { return name + " [" + id + "]"; }
}
