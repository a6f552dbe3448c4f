package com.example.reme.storage;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Keeps everything in process memory. Used by tests and by throwaway stores. */
public class InMemoryBackend implements StoreBackend {
    private final Map<String, ArrayNode> collections = new ConcurrentHashMap<>();
    private volatile List<CollectionSchema> schemas = List.of();

    @Override public void open() {}

    @Override public List<CollectionSchema> readSchemas() { return new ArrayList<>(schemas); }

    @Override public void writeSchemas(List<CollectionSchema> schemas) { this.schemas = List.copyOf(schemas); }

    @Override public ArrayNode read(String collection) {
        ArrayNode rows = collections.get(collection);
        return rows == null ? JsonNodeFactory.instance.arrayNode() : rows.deepCopy();
    }

    @Override public void write(String collection, ArrayNode rows) { collections.put(collection, rows.deepCopy()); }
}
