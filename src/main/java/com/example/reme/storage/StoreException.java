package com.example.reme.storage;

/** Base type for failures raised by the record store and the services built on it. */
public class StoreException extends RuntimeException {
    public StoreException(String message) { super(message); }
    public StoreException(String message, Throwable cause) { super(message, cause); }
}
