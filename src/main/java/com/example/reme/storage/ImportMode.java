package com.example.reme.storage;

public enum ImportMode {
    /** Upsert by primary key; records not in the input are kept. */
    MERGE,
    /** Clear the collection, then write the input. */
    REPLACE
}
