package com.example.reme.storage;

/**
 * Receives committed changes. Register through {@link RecordStore#subscribe} and close the
 * returned {@link Subscription} to stop receiving events.
 */
@FunctionalInterface
public interface StoreListener {
    void onChange(StoreEvent event);
}
