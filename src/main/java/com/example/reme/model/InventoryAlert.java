package com.example.reme.model;

import java.time.LocalDate;

/** Derived on demand from inventory; never stored. */
public class InventoryAlert {
    public enum Type { EXPIRED, EXPIRING_SOON, LOW_STOCK }
    public enum Priority { HIGH, MEDIUM, LOW }

    public String id;
    public Type type;
    public String ingredientId;
    public String ingredientName;
    public String message;
    public Priority priority;
    public LocalDate date;

    public InventoryAlert() {}
    public InventoryAlert(String id, Type type, String ingredientId, String ingredientName, String message, Priority priority, LocalDate date) {
        this.id = id; this.type = type; this.ingredientId = ingredientId; this.ingredientName = ingredientName;
        this.message = message; this.priority = priority; this.date = date;
    }

    @Override public String toString() { return "[" + priority + "] " + message; }
}
