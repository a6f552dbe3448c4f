package com.example.reme.model;

/** Free-text shelf life hints per storage area, e.g. "3-4 días". Any of them may be null. */
public class StorageInfo {
    public String refrigerator;
    public String freezer;
    public String pantry;

    public StorageInfo() {}
    public StorageInfo(String refrigerator, String freezer, String pantry) {
        this.refrigerator = refrigerator; this.freezer = freezer; this.pantry = pantry;
    }
}
