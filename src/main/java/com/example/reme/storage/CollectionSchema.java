package com.example.reme.storage;

import java.util.ArrayList;
import java.util.List;

/** Declares a named collection, the field holding its primary key, and its secondary indexes. */
public class CollectionSchema {
    public String name;
    public String keyPath = "id";
    public List<IndexSpec> indexes = new ArrayList<>();

    public CollectionSchema() {}
    public CollectionSchema(String name, String keyPath, List<IndexSpec> indexes) {
        this.name = name; this.keyPath = keyPath; this.indexes = new ArrayList<>(indexes);
    }

    public static CollectionSchema of(String name, IndexSpec... indexes) {
        return new CollectionSchema(name, "id", List.of(indexes));
    }

    public IndexSpec index(String indexName) {
        for (IndexSpec spec : indexes) if (spec.name.equals(indexName)) return spec;
        return null;
    }
}
