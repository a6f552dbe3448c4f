package com.example.reme.storage;

/** Handle for a registered {@link StoreListener}; closing it unsubscribes. Closing twice is harmless. */
public interface Subscription extends AutoCloseable {
    @Override
    void close();
}
