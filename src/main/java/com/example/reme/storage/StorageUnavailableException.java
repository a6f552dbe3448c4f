package com.example.reme.storage;

/** The underlying storage could not be opened or persisted. Never retried by the store. */
public class StorageUnavailableException extends StoreException {
    public StorageUnavailableException(String message) { super(message); }
    public StorageUnavailableException(String message, Throwable cause) { super(message, cause); }
}
