package com.example.reme.model;

import java.time.Instant;
import java.time.LocalDate;

/** Stock on hand. Several items may point at the same ingredient (other location or batch). */
public class InventoryItem {
    public String id;
    public String ingredientId;
    public double quantity;
    public String unit;
    public String location;
    public LocalDate purchaseDate;
    public LocalDate expirationDate;     // nullable
    public Double lowStockThreshold;     // nullable
    public String brand;
    public String notes;
    public Instant createdAt;
    public Instant updatedAt;

    public InventoryItem() {}
    public InventoryItem(String id, String ingredientId, double quantity, String unit, String location, LocalDate expirationDate) {
        this.id = id; this.ingredientId = ingredientId; this.quantity = quantity; this.unit = unit;
        this.location = location; this.expirationDate = expirationDate;
    }
}
