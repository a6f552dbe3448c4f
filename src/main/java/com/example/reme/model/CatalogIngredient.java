package com.example.reme.model;

import java.util.ArrayList;
import java.util.List;

/** Master ingredient of the shared catalog. Only {@code id} is unique. */
public class CatalogIngredient {
    public String id;
    public String name;
    public String normalizedName;
    public String category;
    public String subcategory;
    public List<String> synonyms = new ArrayList<>();
    public String defaultUnit;
    public List<String> alternativeUnits = new ArrayList<>();
    public NutritionInfo nutrition;
    public StorageInfo storage;
    public List<String> compatibleWith = new ArrayList<>();
    public List<String> substitutes = new ArrayList<>();
    public boolean isCommon;
    public String imageUrl;

    public CatalogIngredient() {}
    public CatalogIngredient(String id, String name, String normalizedName, String category, List<String> synonyms) {
        this.id = id; this.name = name; this.normalizedName = normalizedName; this.category = category;
        this.synonyms = synonyms == null ? new ArrayList<>() : new ArrayList<>(synonyms);
    }

    @Override public String toString() { return name + " [" + id + "]"; }
}
