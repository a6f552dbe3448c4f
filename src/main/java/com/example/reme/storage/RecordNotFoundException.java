package com.example.reme.storage;

/** Raised only by operations that require an existing record; plain reads return empty instead. */
public class RecordNotFoundException extends StoreException {
    private final String collection;
    private final String id;

    public RecordNotFoundException(String collection, String id, String message) {
        super(message);
        this.collection = collection;
        this.id = id;
    }

    public String getCollection() { return collection; }
    public String getId() { return id; }
}
