package com.example.reme.storage;

import com.fasterxml.jackson.databind.node.ArrayNode;

import java.util.List;

/**
 * Where a {@link RecordStore} keeps its collections between runs. Implementations report
 * every I/O problem as {@link StorageUnavailableException}.
 */
public interface StoreBackend extends AutoCloseable {

    /** Makes the storage ready for use; called once before any other method. */
    void open();

    /** Schemas persisted by an earlier run, empty for a fresh store. */
    List<CollectionSchema> readSchemas();

    void writeSchemas(List<CollectionSchema> schemas);

    /** All rows of a collection, empty when the collection was never written. */
    ArrayNode read(String collection);

    void write(String collection, ArrayNode rows);

    @Override
    default void close() {}
}
