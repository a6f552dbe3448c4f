package com.example.reme.storage;

/** A committed change to one collection. {@code id} is null for {@link Type#CLEAR}. */
public class StoreEvent {
    public enum Type { PUT, DELETE, CLEAR }

    public final String collection;
    public final Type type;
    public final String id;

    public StoreEvent(String collection, Type type, String id) {
        this.collection = collection; this.type = type; this.id = id;
    }

    @Override public String toString() { return type + " " + collection + (id == null ? "" : "/" + id); }
}
