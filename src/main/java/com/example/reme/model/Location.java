package com.example.reme.model;

public class Location {
    public String id;
    public String name;     // unique
    public String icon;
    public int order;
    public boolean isDefault;

    public Location() {}
    public Location(String id, String name, String icon, int order, boolean isDefault) {
        this.id = id; this.name = name; this.icon = icon; this.order = order; this.isDefault = isDefault;
    }
}
